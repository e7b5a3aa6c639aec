package com.mikov.accountvalidator.connection;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remote connection used to probe an account. Every operation may fail with an
 * unchecked exception; its message (and any numeric code embedded in it) is the
 * evidence the classifier works from.
 *
 * @author zahari.mikov
 */
public interface AccountConnection {

    /**
     * Checks whether the account identifier is registered.
     *
     * @param jid The normalized account identifier
     * @return One entry per looked-up identifier
     */
    List<ExistenceResult> checkExistence(final String jid);

    Optional<StatusPayload> fetchStatus(final String jid);

    /**
     * Fetches the profile picture location.
     *
     * @param jid The normalized account identifier
     * @param size Requested picture size, e.g. {@code image}
     * @return The picture URL if the account exposes one
     */
    Optional<String> fetchProfilePicture(final String jid, final String size);

    Optional<Map<String, Object>> fetchBusinessProfile(final String jid);

    Optional<Map<String, Object>> subscribePresence(final String jid);
}

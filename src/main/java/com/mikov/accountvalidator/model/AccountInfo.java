package com.mikov.accountvalidator.model;

import lombok.Data;

/**
 * Account details learned from successful probes.
 */
@Data
public class AccountInfo {
    private boolean hasStatus;
    private String statusText;
    private boolean hasProfilePicture;
    private boolean businessAccount;
    private AccountAge age = AccountAge.UNKNOWN;
    private boolean presenceAvailable;

    AccountInfo copy() {
        final var copy = new AccountInfo();
        copy.hasStatus = hasStatus;
        copy.statusText = statusText;
        copy.hasProfilePicture = hasProfilePicture;
        copy.businessAccount = businessAccount;
        copy.age = age;
        copy.presenceAvailable = presenceAvailable;
        return copy;
    }
}

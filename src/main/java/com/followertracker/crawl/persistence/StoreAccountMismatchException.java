package com.followertracker.crawl.persistence;

public class StoreAccountMismatchException extends RuntimeException {
    private final String storedAccount;
    private final String requestedAccount;

    public StoreAccountMismatchException(String storedAccount, String requestedAccount) {
        super("Store already tracks account " + storedAccount + "; refusing to crawl " + requestedAccount);
        this.storedAccount = storedAccount;
        this.requestedAccount = requestedAccount;
    }

    public String storedAccount() {
        return storedAccount;
    }

    public String requestedAccount() {
        return requestedAccount;
    }
}

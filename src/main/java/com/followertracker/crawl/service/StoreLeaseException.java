package com.followertracker.crawl.service;

public class StoreLeaseException extends RuntimeException {
    public StoreLeaseException(String message) {
        super(message);
    }
}

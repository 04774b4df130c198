package com.events.catalog.service.registration;

public interface UserLookup {

    boolean exists(Long userId);
}

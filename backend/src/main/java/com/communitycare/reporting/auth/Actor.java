package com.communitycare.reporting.auth;

import com.communitycare.reporting.model.UserAccount;
import com.communitycare.reporting.model.UserRole;

/** The user on whose behalf a service call runs. */
public record Actor(Long id, UserRole role) {

    public static Actor of(UserAccount user) {
        return new Actor(user.getId(), user.getRole());
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}

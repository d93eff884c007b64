package com.jobmemory.graph;

import com.jobmemory.shared.error.ValidationException;

import java.util.regex.Pattern;

public final class UserIds {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9_.:@-]{1,128}");

    private UserIds() {}

    public static String validate(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("user_id is required");
        }
        if (!VALID.matcher(userId).matches()) {
            throw new ValidationException("user_id has an invalid format: " + userId);
        }
        return userId;
    }
}

package com.example.pomodoro.helper;

import com.example.pomodoro.exception.AuthenticationRequiredException;
import com.example.pomodoro.security.AuthenticatedUser;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

@Component
public class UserHelper {

    public AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedUser user)) {
            throw new AuthenticationRequiredException();
        }
        return user;
    }

    public Long getCurrentUserId() {
        return getCurrentUser().userId();
    }
}

package com.example.pomodoro.service;

import com.example.pomodoro.IntegrationTestSupport;
import com.example.pomodoro.exception.ConflictException;
import com.example.pomodoro.model.User;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserServiceTest extends IntegrationTestSupport {

    private static final String HASH = "$2a$04$abcdefghijklmnopqrstuuOZJ2Zb1yWm2rBqZ9tFQ6.LhTdyNh0aW";

    @Autowired
    private UserService userService;

    @Test
    void createdUserGetsIdentityAndTimestamp() {
        User user = userService.createUser("alice", "Alice@X.com", HASH);

        assertThat(user.getId()).isNotNull();
        assertThat(user.getEmail()).isEqualTo("alice@x.com");
        assertThat(user.getCreatedAt()).isNotNull();
    }

    @Test
    void duplicateUsernameIsReportedAsSuch() {
        userService.createUser("alice", "a@x.com", HASH);

        assertThatThrownBy(() -> userService.createUser("alice", "b@x.com", HASH))
                .isInstanceOf(ConflictException.class)
                .extracting("field").isEqualTo(ConflictException.Field.USERNAME);
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void duplicateRegistrationDoesNotLogSqlErrors(CapturedOutput output) {
        userService.createUser("alice", "a@x.com", HASH);

        assertThatThrownBy(() -> userService.createUser("alice", "b@x.com", HASH))
                .isInstanceOf(ConflictException.class);
        assertThat(output.getAll()).doesNotContain("SqlExceptionHelper");
    }

    @Test
    void duplicateEmailIsDetectedRegardlessOfCase() {
        userService.createUser("alice", "a@x.com", HASH);

        assertThatThrownBy(() -> userService.createUser("bob", "A@X.COM", HASH))
                .isInstanceOf(ConflictException.class)
                .extracting("field").isEqualTo(ConflictException.Field.EMAIL);
        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    void lookupMatchesUsernameExactlyAndEmailInAnyCase() {
        User alice = userService.createUser("alice", "a@x.com", HASH);

        assertThat(userService.findByUsernameOrEmail("alice")).get().extracting(User::getId).isEqualTo(alice.getId());
        assertThat(userService.findByUsernameOrEmail("A@X.COM")).get().extracting(User::getId).isEqualTo(alice.getId());
        assertThat(userService.findByUsernameOrEmail("Alice")).isEmpty();
        assertThat(userService.findByUsernameOrEmail("")).isEmpty();
        assertThat(userService.findByUsernameOrEmail(null)).isEmpty();
        assertThat(userService.findById(alice.getId())).isPresent();
    }
}

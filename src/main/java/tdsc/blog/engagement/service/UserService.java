package tdsc.blog.engagement.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import tdsc.blog.engagement.domain.User;
import tdsc.blog.engagement.enums.DuplicateField;
import tdsc.blog.engagement.exception.DuplicateFieldException;
import tdsc.blog.engagement.exception.InvalidCredentialsException;
import tdsc.blog.engagement.exception.UserNotFoundException;
import tdsc.blog.engagement.mapper.UserMapper;

import java.time.LocalDateTime;

/**
 * Credential store: registration, password checks and user lookup
 */
@Service
@Slf4j
public class UserService {

    @Autowired
    private UserMapper userMapper;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Autowired
    private MeterRegistry meterRegistry;

    /**
     * Register a new user.
     * Email is checked before username; both comparisons are exact.
     *
     * @throws DuplicateFieldException if the email or username is already taken
     */
    public User register(String username, String email, String password) {
        if (userMapper.findByEmail(email) != null) {
            log.info("Signup failed - email already registered: email={}", email);
            throw emailTaken();
        }
        if (userMapper.findByUsername(username) != null) {
            log.info("Signup failed - username taken: username={}", username);
            throw usernameTaken();
        }

        User user = User.builder()
                .username(username)
                .email(email)
                .passwordHash(passwordEncoder.encode(password))
                .createdAt(LocalDateTime.now())
                .build();

        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException e) {
            // A concurrent signup passed the checks above first
            log.info("Signup lost uniqueness race: username={}, email={}", username, email);
            throw userMapper.findByEmail(email) != null ? emailTaken() : usernameTaken();
        }

        meterRegistry.counter("blog.auth.signups").increment();
        log.info("User registered: userId={}, username={}", user.getUserId(), user.getUsername());
        return user;
    }

    /**
     * Check an email/password pair.
     * An unknown email and a wrong password raise the same exception.
     *
     * @throws InvalidCredentialsException if the email is unknown or the password does not match
     */
    public User authenticate(String email, String password) {
        User user = userMapper.findByEmail(email);
        if (user == null) {
            log.info("Signin failed - user not found: email={}", email);
            meterRegistry.counter("blog.auth.signins", "result", "failure").increment();
            throw new InvalidCredentialsException();
        }
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            log.info("Signin failed - invalid password: email={}", email);
            meterRegistry.counter("blog.auth.signins", "result", "failure").increment();
            throw new InvalidCredentialsException();
        }

        meterRegistry.counter("blog.auth.signins", "result", "success").increment();
        log.info("Signin successful: userId={}", user.getUserId());
        return user;
    }

    /**
     * Get user by ID
     *
     * @throws UserNotFoundException if no such user exists
     */
    public User getUserById(Long userId) {
        User user = userMapper.findById(userId);
        if (user == null) {
            throw new UserNotFoundException("User not found: " + userId);
        }
        return user;
    }

    private static DuplicateFieldException emailTaken() {
        return new DuplicateFieldException(DuplicateField.EMAIL, "Email already registered");
    }

    private static DuplicateFieldException usernameTaken() {
        return new DuplicateFieldException(DuplicateField.USERNAME, "Username already taken");
    }
}

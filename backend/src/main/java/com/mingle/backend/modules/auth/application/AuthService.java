package com.mingle.backend.modules.auth.application;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

import com.mingle.backend.global.error.ProblemException;
import com.mingle.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.mingle.backend.modules.auth.domain.MingleUser;
import com.mingle.backend.modules.auth.infrastructure.persistence.MingleUserRepository;
import com.mingle.backend.modules.auth.presentation.dto.AuthResponse;
import com.mingle.backend.modules.auth.presentation.dto.LoginRequest;
import com.mingle.backend.modules.auth.presentation.dto.RegisterRequest;
import com.mingle.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^\\S+@\\S+\\.\\S+$");
    private static final int NAME_MIN_LENGTH = 2;
    private static final int NAME_MAX_LENGTH = 60;
    private static final int EMAIL_MAX_LENGTH = 254;
    private static final int PASSWORD_MIN_LENGTH = 8;
    // BCrypt only looks at the first 72 bytes
    private static final int PASSWORD_MAX_LENGTH = 72;

    private final MingleUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            MingleUserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public AuthResponse register(RegisterRequest request) {
        String name = request.name() == null ? "" : request.name().trim();
        String email = normalizeEmail(request.email());
        String password = request.password() == null ? "" : request.password();

        if (name.length() < NAME_MIN_LENGTH || name.length() > NAME_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_NAME",
                    "Name must be " + NAME_MIN_LENGTH + "-" + NAME_MAX_LENGTH + " characters");
        }
        if (email.length() > EMAIL_MAX_LENGTH || !EMAIL_PATTERN.matcher(email).matches()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_EMAIL", "Invalid email format");
        }
        if (password.length() < PASSWORD_MIN_LENGTH || password.length() > PASSWORD_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_PASSWORD",
                    "Password must be " + PASSWORD_MIN_LENGTH + "-" + PASSWORD_MAX_LENGTH + " characters");
        }
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(HttpStatus.CONFLICT, "EMAIL_ALREADY_REGISTERED", "Email already registered");
        }

        MingleUser user = new MingleUser();
        user.setName(name);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(password));

        MingleUser saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent registration of the same email
            throw new ProblemException(HttpStatus.CONFLICT, "EMAIL_ALREADY_REGISTERED", "Email already registered");
        }
        log.info("Registered user {}", saved.getId());
        return issueFor(saved);
    }

    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        MingleUser user = userRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.debug("Password mismatch for user {}", user.getId());
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }
        return issueFor(user);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        return userRepository.findById(userId)
                .map(AuthService::toProfile)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNKNOWN_USER"));
    }

    private AuthResponse issueFor(MingleUser user) {
        IssuedToken token = jwtTokenService.issueAccessToken(user.getId(), user.getEmail(), user.getName());
        return new AuthResponse(
                toProfile(user),
                token.accessToken(),
                JwtTokenService.TOKEN_TYPE,
                token.expiresIn(),
                token.issuedAt()
        );
    }

    private static UserProfileResponse toProfile(MingleUser user) {
        return new UserProfileResponse(user.getId(), user.getName(), user.getEmail(), user.getCreatedAt());
    }

    private static String normalizeEmail(String rawEmail) {
        return rawEmail == null ? "" : rawEmail.trim().toLowerCase(Locale.ROOT);
    }
}

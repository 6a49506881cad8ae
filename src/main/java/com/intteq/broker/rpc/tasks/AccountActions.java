package com.intteq.broker.rpc.tasks;

import com.intteq.broker.rpc.annotation.RpcAction;
import com.intteq.broker.rpc.annotation.RpcController;
import com.intteq.broker.rpc.dispatch.HandlerResult;
import com.intteq.broker.rpc.dispatch.Principal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registration and login. Both are available without a token.
 */
@Slf4j
@RpcController(description = "User accounts")
@RequiredArgsConstructor
public class AccountActions {

    private final UserRepository users;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokens;
    private final Clock clock;

    @Transactional
    @RpcAction(value = "register", authenticated = false)
    public HandlerResult register(Principal principal, String version, Map<String, Object> data) {
        RequestData args = new RequestData(data);
        if (args.isBlank("email") || args.isBlank("password") || args.isBlank("full_name")) {
            return HandlerResult.error("email/password/full_name required");
        }
        String email = args.text("email");
        if (users.findByEmail(email).isPresent()) {
            return HandlerResult.error("User already exists");
        }

        UserEntity user = users.saveAndFlush(new UserEntity(
                email,
                passwordEncoder.encode(args.text("password")),
                args.text("full_name"),
                LocalDateTime.now(clock)));
        log.info("Registered user {} ({})", user.getId(), email);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("id", user.getId());
        result.put("email", user.getEmail());
        result.put("full_name", user.getFullName());
        return HandlerResult.ok(result);
    }

    @Transactional(readOnly = true)
    @RpcAction(value = "login", authenticated = false)
    public HandlerResult login(Principal principal, String version, Map<String, Object> data) {
        RequestData args = new RequestData(data);
        if (args.isBlank("email") || args.isBlank("password")) {
            return HandlerResult.error("email/password required");
        }

        Optional<UserEntity> user = users.findByEmail(args.text("email"))
                .filter(u -> passwordEncoder.matches(args.text("password"), u.getPasswordHash()));
        if (user.isEmpty()) {
            return HandlerResult.error("Incorrect email or password");
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("access_token", tokens.issue(user.get().getId()));
        result.put("token_type", "bearer");
        return HandlerResult.ok(result);
    }
}

package com.communitycare.reporting.auth;

import com.communitycare.reporting.exception.UnauthorizedException;
import com.communitycare.reporting.repository.UserAccountRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds the {@link Actor} for a request from the {@value #ACTOR_HEADER} header. The role always comes from
 * the stored account, so a role change takes effect on the user's next request.
 */
@Component
public class ActorResolver {

    public static final String ACTOR_HEADER = "X-User-Id";

    private final UserAccountRepository userRepository;

    public ActorResolver(UserAccountRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Transactional(readOnly = true)
    public Actor resolve(Long userId) {
        if (userId == null) {
            throw new UnauthorizedException("Missing " + ACTOR_HEADER + " header");
        }
        return userRepository.findById(userId)
                .map(Actor::of)
                .orElseThrow(() -> new UnauthorizedException("Unknown user: " + userId));
    }
}

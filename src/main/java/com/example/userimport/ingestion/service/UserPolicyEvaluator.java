package com.example.userimport.ingestion.service;

import com.example.userimport.ingestion.config.IngestionProperties;
import com.example.userimport.ingestion.model.PolicyOutcome;
import com.example.userimport.ingestion.model.PolicySkipReason;
import com.example.userimport.ingestion.model.User;
import com.example.userimport.ingestion.repository.UserRepository;
import com.example.userimport.ingestion.support.ImportError;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class UserPolicyEvaluator {

    private final UserRepository repository;
    private final Predicate<String> disposableDomain;

    @Autowired
    public UserPolicyEvaluator(UserRepository repository, IngestionProperties properties) {
        this(repository, domainSet(properties.disposableDomains()));
    }

    public UserPolicyEvaluator(UserRepository repository, Predicate<String> disposableDomain) {
        this.repository = repository;
        this.disposableDomain = disposableDomain;
    }

    public PolicyOutcome evaluate(User user) {
        String domain = user.emailDomain();
        if (disposableDomain.test(domain)) {
            return skip(user, PolicySkipReason.DISPOSABLE_EMAIL,
                    "Disposable email domain is not allowed", Map.of("domain", domain));
        }

        Optional<User> byId = repository.findById(user.id());
        if (byId.isPresent()) {
            User stored = byId.get();
            if (!user.updatedAt().isAfter(stored.updatedAt())) {
                return skip(user, PolicySkipReason.STALE_UPDATE,
                        "Incoming record is older than the stored version",
                        Map.of("id", user.id(),
                                "storedAt", stored.updatedAt().toString(),
                                "incomingAt", user.updatedAt().toString()));
            }
            return PolicyOutcome.accept(user);
        }

        Optional<User> byEmail = repository.findByEmail(user.email());
        if (byEmail.isPresent() && byEmail.get().name().equalsIgnoreCase(user.name())) {
            User matched = byEmail.get();
            return skip(user, PolicySkipReason.DUPLICATE,
                    "Duplicate user detected by email and name",
                    Map.of("id", matched.id(), "email", matched.email()));
        }
        return PolicyOutcome.accept(user);
    }

    private static PolicyOutcome skip(User user, PolicySkipReason reason, String message,
            Map<String, Object> details) {
        log.debug("Policy skip userId={} reason={}", user.id(), reason.label());
        return PolicyOutcome.skip(user, reason, ImportError.policy(reason.code(), message, details));
    }

    private static Predicate<String> domainSet(Iterable<String> domains) {
        Set<String> normalized = new HashSet<>();
        for (String domain : domains) {
            if (domain != null && !domain.isBlank()) {
                normalized.add(domain.trim().toLowerCase(Locale.ROOT));
            }
        }
        Set<String> frozen = Set.copyOf(normalized);
        return domain -> domain != null && frozen.contains(domain.toLowerCase(Locale.ROOT));
    }
}

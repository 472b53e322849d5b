package com.astradesk.helpdesk.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;

import com.astradesk.helpdesk.domain.CallerIdentity;
import com.astradesk.helpdesk.domain.PermissionKey;
import com.astradesk.helpdesk.error.UnauthenticatedCallerException;

import reactor.test.StepVerifier;

@DisplayName("CallerIdentityResolver")
class CallerIdentityResolverTest {

    private final CallerIdentityResolver resolver = new CallerIdentityResolver();

    private static Jwt jwt(Consumer<Jwt.Builder> claims) {
        Jwt.Builder builder = Jwt.withTokenValue("token").header("alg", "none").subject("agent");
        claims.accept(builder);
        return builder.build();
    }

    @Test
    @DisplayName("Id agenta z claimu uid, login z preferred_username")
    void readsUidClaim() {
        CallerIdentity caller = resolver.resolve(jwt(b -> b.claim("uid", 7).claim("preferred_username", "jdoe")));

        assertThat(caller.userId()).isEqualTo(7L);
        assertThat(caller.login()).isEqualTo("jdoe");
        assertThat(caller.hasPrecomputedAccess()).isFalse();
    }

    @Test
    @DisplayName("Liczbowy sub jest używany, gdy brak uid")
    void fallsBackToNumericSubject() {
        CallerIdentity caller = resolver.resolve(jwt(b -> b.subject("12")));

        assertThat(caller.userId()).isEqualTo(12L);
        assertThat(caller.login()).isEqualTo("12");
    }

    @Test
    @DisplayName("Token bez identyfikatora agenta jest odrzucany")
    void rejectsTokensWithoutAgent() {
        assertThatThrownBy(() -> resolver.resolve(jwt(b -> b.claim("uid", "not-a-number"))))
            .isInstanceOf(UnauthenticatedCallerException.class);
        assertThatThrownBy(() -> resolver.resolve(jwt(b -> b.claim("uid", 0))))
            .isInstanceOf(UnauthenticatedCallerException.class);
    }

    @Test
    @DisplayName("Wariant reaktywny zamienia błąd na sygnał error")
    void reactiveVariantSignalsError() {
        StepVerifier.create(resolver.caller(jwt(b -> b.subject("robot"))))
            .expectError(UnauthenticatedCallerException.class)
            .verify();
    }

    @Test
    @DisplayName("queue_admin daje pełny dostęp bez zapytań")
    void queueAdminClaim() {
        CallerIdentity caller = resolver.resolve(jwt(b -> b.claim("uid", 7).claim("queue_admin", true)));

        assertThat(caller.precomputedAccess().admin()).isTrue();
        assertThat(caller.precomputedAccess().appliesTo(PermissionKey.OWNER)).isTrue();
    }

    @Test
    @DisplayName("queue_ids z queue_capability dotyczą tylko tej zdolności")
    void queueIdsClaim() {
        CallerIdentity caller = resolver.resolve(jwt(b -> b
            .claim("uid", 7)
            .claim("queue_ids", List.of(10, "20", -1))
            .claim("queue_capability", "note")));

        assertThat(caller.precomputedAccess().queueIds()).containsExactlyInAnyOrder(10L, 20L);
        assertThat(caller.precomputedAccess().appliesTo(PermissionKey.NOTE)).isTrue();
        assertThat(caller.precomputedAccess().appliesTo(PermissionKey.RO)).isFalse();
    }
}

package com.planner.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.planner.security.testing.TestTokenFactory;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecurityProperties")
class SecurityPropertiesTest {

    @Test
    @DisplayName("defaults the clock skew to zero")
    void appliesDefaults() {
        var props = new SecurityProperties(TestTokenFactory.SECRET, null);

        assertThat(props.clockSkew()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("keeps an explicit clock skew")
    void keepsExplicitValues() {
        var props = new SecurityProperties(TestTokenFactory.SECRET, Duration.ofSeconds(5));

        assertThat(props.clockSkew()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("builds a resolver that accepts credentials minted with the same secret")
    void buildsResolver() {
        var props = new SecurityProperties(TestTokenFactory.SECRET, null);

        IdentityResolver resolver = props.identityResolver(Clock.systemUTC());

        assertThat(resolver.resolve(TestTokenFactory.tokenFor("carol")))
                .isEqualTo(TenantIdentity.of("carol"));
    }

    @Test
    @DisplayName("tenant identities compare by value")
    void identitiesCompareByValue() {
        assertThat(TenantIdentity.of("a")).isEqualTo(new TenantIdentity("a"));
        assertThat(TenantIdentity.of("a")).isLessThan(TenantIdentity.of("b"));
        assertThat(TenantIdentity.of("a").toString()).isEqualTo("a");
    }
}

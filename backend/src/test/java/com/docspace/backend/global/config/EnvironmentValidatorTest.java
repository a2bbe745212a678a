package com.docspace.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/docspace")
                .withProperty("jwt.secret", "prod-access-secret-0123456789abcdef-0123")
                .withProperty("jwt.refresh-secret", "prod-refresh-secret-0123456789abcdef-0123")
                .withProperty("jwt.expiration", "900000")
                .withProperty("jwt.refresh-expiration", "604800000")
                .withProperty("app.cors.allowed-origins", "https://docs.example.com");
    }

    @Test
    void completeConfigurationPasses() {
        environment.setActiveProfiles("prod");

        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void developmentSecretsAreRejectedInProduction() {
        environment.setActiveProfiles("prod");
        environment.setProperty("jwt.secret", EnvironmentValidator.DEV_ACCESS_SECRET);
        environment.setProperty("jwt.refresh-secret", EnvironmentValidator.DEV_REFRESH_SECRET);

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .contains("jwt.secret still uses the development default",
                        "jwt.refresh-secret still uses the development default");
    }

    @Test
    void developmentSecretsAreAcceptedOutsideProduction() {
        environment.setProperty("jwt.secret", EnvironmentValidator.DEV_ACCESS_SECRET);
        environment.setProperty("jwt.refresh-secret", EnvironmentValidator.DEV_REFRESH_SECRET);

        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void sharedOrShortSecretsAreRejected() {
        environment.setProperty("jwt.refresh-secret", "prod-access-secret-0123456789abcdef-0123");
        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.secret and jwt.refresh-secret must differ");

        environment.setProperty("jwt.refresh-secret", "short");
        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.refresh-secret must yield a key of at least 32 bytes");
    }

    @Test
    void hexSecretThatDecodesToAShortKeyIsRejected() {
        // 32 hex characters are valid Base64 and decode to only 24 bytes
        environment.setProperty("jwt.secret", "0123456789abcdef0123456789abcdef");
        environment.setProperty("jwt.refresh-secret", "fedcba9876543210fedcba9876543210");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactlyInAnyOrder("jwt.secret must yield a key of at least 32 bytes",
                        "jwt.refresh-secret must yield a key of at least 32 bytes");
    }

    @Test
    void longBase64SecretsPass() {
        environment.setProperty("jwt.secret", "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=");
        environment.setProperty("jwt.refresh-secret", "ZmVkY2JhOTg3NjU0MzIxMGZlZGNiYTk4NzY1NDMyMTA=");

        assertThat(new EnvironmentValidator(environment).collectProblems()).isEmpty();
    }

    @Test
    void missingSettingFailsStartup() {
        MockEnvironment bare = new MockEnvironment().withProperty("jwt.expiration", "abc");
        EnvironmentValidator validator = new EnvironmentValidator(bare);

        assertThat(validator.collectProblems())
                .contains("jwt.secret is required", "jwt.expiration must be a number of milliseconds");
        assertThatThrownBy(validator::validateEnvironment)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("spring.datasource.url is required");
    }
}

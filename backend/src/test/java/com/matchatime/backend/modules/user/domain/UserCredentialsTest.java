package com.matchatime.backend.modules.user.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class UserCredentialsTest {

    @Test
    void ofPicksVariantFromPresentCredentials() {
        assertThat(UserCredentials.of("hash", null)).isInstanceOf(UserCredentials.PasswordOnly.class);
        assertThat(UserCredentials.of(null, "sub-1")).isInstanceOf(UserCredentials.FederatedOnly.class);
        assertThat(UserCredentials.of("hash", "sub-1")).isInstanceOf(UserCredentials.Linked.class);
        assertThat(UserCredentials.of(" ", "sub-1")).isInstanceOf(UserCredentials.FederatedOnly.class);
    }

    @Test
    void accountWithoutAnyCredentialCannotExist() {
        assertThatThrownBy(() -> UserCredentials.of(null, " ")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new UserCredentials.PasswordOnly(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void linkingKeepsExistingPassword() {
        UserCredentials linked = new UserCredentials.PasswordOnly("hash").withFederatedId("sub-1");

        assertThat(linked.canUsePassword()).isTrue();
        assertThat(linked.isFederated()).isTrue();
        assertThat(linked.findPasswordHash()).contains("hash");
    }

    @Test
    void settingPasswordOnFederatedAccountLinksBoth() {
        UserCredentials updated = new UserCredentials.FederatedOnly("sub-1").withPasswordHash("new-hash");

        assertThat(updated).isEqualTo(new UserCredentials.Linked("new-hash", "sub-1"));
    }

    @Test
    void federatedOnlyAccountCannotUsePassword() {
        AppUser user = AppUser.federated("alice", "alice@example.com", "sub-1", null);

        assertThat(user.getCredentials().canUsePassword()).isFalse();
        assertThat(user.isEmailVerified()).isTrue();
        assertThat(AppUser.withPassword("bob", "bob@example.com", "hash").isEmailVerified()).isFalse();
    }
}

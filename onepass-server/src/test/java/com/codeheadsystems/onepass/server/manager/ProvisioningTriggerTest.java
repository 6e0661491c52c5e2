package com.codeheadsystems.onepass.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.onepass.server.auth.Role;
import com.codeheadsystems.onepass.server.exception.NoActiveKeyException;
import com.codeheadsystems.onepass.server.model.Pass;
import com.codeheadsystems.onepass.server.model.PassPayload;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.store.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProvisioningTriggerTest {

  @Mock private PassIssuer passIssuer;

  @Test
  void onAuthUserCreated_issuesPass() {
    when(passIssuer.issueOrGetPass("u1"))
        .thenReturn(Pass.issued(new PassPayload("u1", "k1", 1L, 1), "sig"));

    new ProvisioningTrigger(passIssuer).onAuthUserCreated("u1");

    verify(passIssuer).issueOrGetPass("u1");
  }

  @Test
  void issuanceFailure_doesNotPropagate() {
    when(passIssuer.issueOrGetPass("u1")).thenThrow(new NoActiveKeyException("No active signing key"));

    assertThatCode(() -> new ProvisioningTrigger(passIssuer).onAuthUserCreated("u1"))
        .doesNotThrowAnyException();
  }

  @Test
  void registeredAsListener_firesOncePerNewUser() {
    when(passIssuer.issueOrGetPass("u1"))
        .thenReturn(Pass.issued(new PassPayload("u1", "k1", 1L, 1), "sig"));
    InMemoryDocumentStore store = new InMemoryDocumentStore();
    store.addUserCreatedListener(new ProvisioningTrigger(passIssuer));

    assertThat(store.createUser(UserRecord.of("u1", Role.USER))).isTrue();
    assertThat(store.createUser(UserRecord.of("u1", Role.USER))).isFalse();

    verify(passIssuer, times(1)).issueOrGetPass("u1");
  }

  @Test
  void listenerFailure_stillCreatesAccount() {
    when(passIssuer.issueOrGetPass("u1")).thenThrow(new IllegalStateException("store down"));
    InMemoryDocumentStore store = new InMemoryDocumentStore();
    store.addUserCreatedListener(new ProvisioningTrigger(passIssuer));

    assertThat(store.createUser(UserRecord.of("u1", Role.USER))).isTrue();
    assertThat(store.findUser("u1")).isPresent();
  }
}

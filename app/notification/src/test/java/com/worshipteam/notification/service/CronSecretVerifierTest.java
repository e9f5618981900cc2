package com.worshipteam.notification.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.worshipteam.notification.config.CronProperties;
import org.junit.jupiter.api.Test;

class CronSecretVerifierTest {

  @Test
  void matchingSecretIsAccepted() {
    final CronSecretVerifier verifier = new CronSecretVerifier(new CronProperties(null, "s3cret"));

    assertThatCode(() -> verifier.verify("s3cret")).doesNotThrowAnyException();
  }

  @Test
  void missingOrWrongSecretIsRejected() {
    final CronSecretVerifier verifier = new CronSecretVerifier(new CronProperties(null, "s3cret"));

    assertThatThrownBy(() -> verifier.verify(null)).isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> verifier.verify("other")).isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void unsetSecretRejectsEveryCaller() {
    final CronSecretVerifier verifier = new CronSecretVerifier(new CronProperties(null, null));

    assertThatThrownBy(() -> verifier.verify("")).isInstanceOf(UnauthorizedException.class);
    assertThatThrownBy(() -> verifier.verify("anything"))
        .isInstanceOf(UnauthorizedException.class);
  }
}

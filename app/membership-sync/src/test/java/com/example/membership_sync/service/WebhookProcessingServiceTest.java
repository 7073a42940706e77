package com.example.membership_sync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.membership_sync.config.MembershipSyncProperties;
import com.example.membership_sync.model.InboundEvent;
import com.example.membership_sync.model.ReconciliationOutcome;
import com.example.membership_sync.model.Tenant;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class WebhookProcessingServiceTest {

  private final TenantResolver tenantResolver = mock(TenantResolver.class);
  private final MembershipReconciler reconciler = mock(MembershipReconciler.class);

  @Test
  void ignoresEventKindsOtherThanSignupAndInvitation() {
    final ReconciliationOutcome outcome =
        service("tenant-source", false)
            .process("{\"eventKey\":\"frontegg.user.loggedIn\",\"user\":{\"email\":\"a@acme.io\"}}");

    assertThat(outcome.status()).isEqualTo(ReconciliationOutcome.Status.IGNORED);
    verifyNoInteractions(tenantResolver, reconciler);
  }

  @Test
  void ignoresPayloadWithoutRecognizableShape() {
    assertThat(service("tenant-source", false).process("[]").status())
        .isEqualTo(ReconciliationOutcome.Status.IGNORED);
  }

  @Test
  void reconcilesSignupIntoDerivedTenant() {
    final Tenant acme = new Tenant("tenant-acme", "Acme");
    when(tenantResolver.resolve("Acme")).thenReturn(acme);
    when(reconciler.reconcile(
            new InboundEvent(
                "frontegg.user.signedUp", "user-1", "alice@acme.io", "", "", ""),
            acme,
            "tenant-source"))
        .thenReturn(ReconciliationOutcome.applied("user reconciled into tenant Acme"));

    final ReconciliationOutcome outcome =
        service("tenant-source", false)
            .process(
                """
                {"eventKey":"frontegg.user.signedUp","eventContext":{"userId":"user-1"},
                 "user":{"email":"alice@acme.io"}}
                """);

    assertThat(outcome.status()).isEqualTo(ReconciliationOutcome.Status.APPLIED);
    assertThat(MDC.get("event_kind")).isNull();
    assertThat(MDC.get("user_id")).isNull();
  }

  @Test
  void ignoresInvitationFromNonDefaultTenant() {
    final ReconciliationOutcome outcome =
        service("tenant-source", false)
            .process(
                """
                {"eventKey":"frontegg.user.invitedToTenant",
                 "eventContext":{"userId":"user-1","tenantId":"tenant-other"},
                 "user":{"email":"alice@acme.io"}}
                """);

    assertThat(outcome.status()).isEqualTo(ReconciliationOutcome.Status.IGNORED);
    verifyNoInteractions(tenantResolver, reconciler);
  }

  @Test
  void reconcilesInvitationFromDefaultTenant() {
    final Tenant acme = new Tenant("tenant-acme", "Acme");
    when(tenantResolver.resolve("Acme")).thenReturn(acme);

    service("tenant-source", false)
        .process(
            """
            {"eventKey":"frontegg.user.invitedToTenant",
             "eventContext":{"userId":"user-1","tenantId":"tenant-source"},
             "user":{"email":"alice@acme.io"}}
            """);

    verify(tenantResolver).resolve("Acme");
  }

  @Test
  void invitationWithoutConfiguredSourceTenantIsConfigurationError() {
    assertThatThrownBy(
            () ->
                service("", false)
                    .process(
                        """
                        {"eventKey":"frontegg.user.invitedToTenant",
                         "eventContext":{"tenantId":"tenant-source"},
                         "user":{"email":"alice@acme.io"}}
                        """))
        .isInstanceOf(SyncConfigurationException.class)
        .hasMessage("default source tenant is not configured");
  }

  @Test
  void acknowledgesSignupWithoutUsableEmail() {
    final ReconciliationOutcome outcome =
        service("tenant-source", false)
            .process("{\"eventKey\":\"frontegg.user.signedUp\",\"user\":{\"id\":\"user-1\"}}");

    assertThat(outcome.status()).isEqualTo(ReconciliationOutcome.Status.ACKNOWLEDGED_NO_ACTION);
    assertThat(outcome.message()).isEqualTo("event has no usable email");
    verifyNoInteractions(tenantResolver, reconciler);
  }

  @Test
  void dryRunComputesTargetWithoutCallingPlatform() {
    final ReconciliationOutcome outcome =
        service("tenant-source", true)
            .process(
                "{\"eventKey\":\"frontegg.user.signedUp\",\"user\":{\"email\":\"x@initech.com\"}}");

    assertThat(outcome.status()).isEqualTo(ReconciliationOutcome.Status.ACKNOWLEDGED_NO_ACTION);
    assertThat(outcome.message()).isEqualTo("dry run: target tenant Initech");
    verifyNoInteractions(tenantResolver, reconciler);
  }

  private WebhookProcessingService service(String defaultSourceTenantId, boolean dryRun) {
    final MembershipSyncProperties properties =
        new MembershipSyncProperties("", defaultSourceTenantId, dryRun, Map.of(), null, null);
    return new WebhookProcessingService(
        new InboundEventNormalizer(new ObjectMapper()),
        new TenantNamePolicy(properties),
        tenantResolver,
        reconciler,
        properties);
  }
}

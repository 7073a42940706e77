package com.example.membership_sync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.membership_sync.model.InboundEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class InboundEventNormalizerTest {

  private final InboundEventNormalizer normalizer = new InboundEventNormalizer(new ObjectMapper());

  @Test
  void readsCurrentPayloadShape() {
    final InboundEvent event =
        normalizer.normalize(
            """
            {
              "eventKey": "frontegg.user.signedUp",
              "eventContext": {"userId": "user-1", "tenantId": "tenant-source"},
              "user": {"id": "user-1", "email": "alice@acme.io", "name": "Alice"}
            }
            """);

    assertThat(event)
        .isEqualTo(
            new InboundEvent(
                "frontegg.user.signedUp", "user-1", "alice@acme.io", "Alice", "", "tenant-source"));
  }

  @Test
  void readsLegacyDataPayloadShape() {
    final InboundEvent event =
        normalizer.normalize(
            """
            {
              "key": "frontegg.user.invitedToTenant",
              "data": {
                "user": {"id": "user-2", "email": "bob@initech.com", "name": "Bob"},
                "tenant": {"tenantId": "tenant-source"}
              }
            }
            """);

    assertThat(event.kind()).isEqualTo("frontegg.user.invitedToTenant");
    assertThat(event.userId()).isEqualTo("user-2");
    assertThat(event.email()).isEqualTo("bob@initech.com");
    assertThat(event.displayName()).isEqualTo("Bob");
    assertThat(event.sourceTenantId()).isEqualTo("tenant-source");
  }

  @Test
  void prefersEventContextUserIdOverUserObject() {
    final InboundEvent event =
        normalizer.normalize(
            """
            {"eventKey":"k","eventContext":{"userId":"ctx-user"},"user":{"id":"body-user"}}
            """);

    assertThat(event.userId()).isEqualTo("ctx-user");
  }

  @Test
  void readsDeclaredTenantNameFromSerializedMetadata() {
    final InboundEvent event =
        normalizer.normalize(
            """
            {"eventKey":"k","user":{"email":"a@b.io","metadata":"{\\"tenantName\\":\\"Globex\\"}"}}
            """);

    assertThat(event.declaredTenantName()).isEqualTo("Globex");
  }

  @Test
  void prefersTopLevelTenantNameOverMetadata() {
    final InboundEvent event =
        normalizer.normalize(
            """
            {"eventKey":"k","tenantName":"Hooli","user":{"metadata":{"tenantName":"Globex"}}}
            """);

    assertThat(event.declaredTenantName()).isEqualTo("Hooli");
  }

  @Test
  void ignoresMetadataThatIsNotJson() {
    final InboundEvent event =
        normalizer.normalize(
            """
            {"eventKey":"k","user":{"email":"a@b.io","metadata":"plain text"}}
            """);

    assertThat(event.hasDeclaredTenantName()).isFalse();
  }

  @Test
  void trimsValuesAndTreatsMissingFieldsAsEmpty() {
    final InboundEvent event =
        normalizer.normalize("{\"eventKey\":\" k \",\"user\":{\"email\":\" a@b.io \"}}");

    assertThat(event.kind()).isEqualTo("k");
    assertThat(event.email()).isEqualTo("a@b.io");
    assertThat(event.hasUserId()).isFalse();
    assertThat(event.hasSourceTenantId()).isFalse();
  }

  @Test
  void returnsUnrecognizedEventForNonObjectJson() {
    assertThat(normalizer.normalize("[1,2,3]")).isEqualTo(InboundEvent.unrecognized());
    assertThat(normalizer.normalize("\"text\"").kind()).isEmpty();
  }

  @Test
  void rejectsMalformedJson() {
    assertThatThrownBy(() -> normalizer.normalize("{not json"))
        .isInstanceOf(WebhookPayloadException.class)
        .hasMessage("request body is not valid JSON");
  }

  @Test
  void rejectsEmptyBody() {
    assertThatThrownBy(() -> normalizer.normalize("  "))
        .isInstanceOf(WebhookPayloadException.class)
        .hasMessage("request body is empty");
  }
}

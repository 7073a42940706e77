/*
 * どこで: Membership-Sync サービス層
 * 何を: 生の Webhook ボディを InboundEvent へ正規化する
 * なぜ: 送信元が出した複数世代のペイロード形状 (eventKey/user/eventContext と key/data.*) を両方受け付けるため
 */
package com.example.membership_sync.service;

import com.example.membership_sync.model.InboundEvent;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class InboundEventNormalizer {

  private static final Logger logger = LoggerFactory.getLogger(InboundEventNormalizer.class);

  // 各フィールドは上から順に探し、最初に空でない値を採用する
  private static final List<JsonPointer> KIND_SOURCES = pointers("/eventKey", "/key");
  private static final List<JsonPointer> USER_ID_SOURCES =
      pointers("/eventContext/userId", "/user/id", "/data/user/id", "/data/userId");
  private static final List<JsonPointer> EMAIL_SOURCES =
      pointers("/user/email", "/data/user/email", "/data/email");
  private static final List<JsonPointer> DISPLAY_NAME_SOURCES =
      pointers("/user/name", "/data/user/name");
  private static final List<JsonPointer> SOURCE_TENANT_ID_SOURCES =
      pointers("/eventContext/tenantId", "/data/tenant/tenantId", "/data/tenant/id", "/tenantId");
  private static final List<JsonPointer> DECLARED_TENANT_NAME_SOURCES =
      pointers("/tenantName", "/user/metadata/tenantName", "/data/user/metadata/tenantName");
  // metadata が JSON 文字列で届く形状
  private static final List<JsonPointer> SERIALIZED_METADATA_SOURCES =
      pointers("/user/metadata", "/data/user/metadata");
  private static final String METADATA_TENANT_NAME_FIELD = "tenantName";

  private final ObjectMapper objectMapper;

  public InboundEvent normalize(String rawBody) {
    if (rawBody == null || rawBody.isBlank()) {
      throw new WebhookPayloadException("request body is empty");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(rawBody);
    } catch (JsonProcessingException ex) {
      throw new WebhookPayloadException("request body is not valid JSON", ex);
    }
    return normalize(root);
  }

  public InboundEvent normalize(JsonNode root) {
    if (root == null || !root.isObject()) {
      return InboundEvent.unrecognized();
    }
    return new InboundEvent(
        firstText(root, KIND_SOURCES),
        firstText(root, USER_ID_SOURCES),
        firstText(root, EMAIL_SOURCES),
        firstText(root, DISPLAY_NAME_SOURCES),
        declaredTenantName(root),
        firstText(root, SOURCE_TENANT_ID_SOURCES));
  }

  private String declaredTenantName(JsonNode root) {
    final String direct = firstText(root, DECLARED_TENANT_NAME_SOURCES);
    if (!direct.isEmpty()) {
      return direct;
    }
    for (JsonPointer pointer : SERIALIZED_METADATA_SOURCES) {
      final JsonNode metadata = root.at(pointer);
      if (!metadata.isTextual() || metadata.asText().isBlank()) {
        continue;
      }
      final String fromMetadata = tenantNameFromSerializedMetadata(metadata.asText());
      if (!fromMetadata.isEmpty()) {
        return fromMetadata;
      }
    }
    return "";
  }

  private String tenantNameFromSerializedMetadata(String serialized) {
    try {
      return text(objectMapper.readTree(serialized).path(METADATA_TENANT_NAME_FIELD));
    } catch (JsonProcessingException ex) {
      logger.debug("user metadata is not JSON; ignoring it for tenant name");
      return "";
    }
  }

  private static String firstText(JsonNode root, List<JsonPointer> sources) {
    for (JsonPointer pointer : sources) {
      final String value = text(root.at(pointer));
      if (!value.isEmpty()) {
        return value;
      }
    }
    return "";
  }

  private static String text(JsonNode node) {
    if (node == null || !node.isValueNode() || node.isNull()) {
      return "";
    }
    return node.asText().trim();
  }

  private static List<JsonPointer> pointers(String... expressions) {
    return Arrays.stream(expressions).map(JsonPointer::compile).toList();
  }
}

package com.assistme.backend.integration.provider.gmail;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** Projects Gmail API message resources onto the flat email shape returned to callers. */
class GmailMessageMapper {

  private final ObjectMapper objectMapper;

  GmailMessageMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  ObjectNode toEmail(JsonNode message) {
    JsonNode payload = message.path("payload");
    Map<String, String> headers = new HashMap<>();
    for (JsonNode header : payload.path("headers")) {
      String name = header.path("name").asText("");
      if (!name.isEmpty()) {
        headers.put(name.toLowerCase(Locale.ROOT), header.path("value").asText(""));
      }
    }

    ObjectNode email = objectMapper.createObjectNode();
    email.put("id", message.path("id").asText(null));
    email.put("thread_id", message.path("threadId").asText(null));
    email.put("subject", headers.getOrDefault("subject", ""));
    email.put("from", headers.getOrDefault("from", ""));
    email.put("to", headers.getOrDefault("to", ""));
    email.put("date", headers.getOrDefault("date", ""));
    email.put("snippet", message.path("snippet").asText(""));
    email.put("body", extractBody(payload));
    ArrayNode labels = email.putArray("labels");
    message.path("labelIds").forEach(label -> labels.add(label.asText()));
    return email;
  }

  ObjectNode toThread(JsonNode thread) {
    ObjectNode result = objectMapper.createObjectNode();
    result.put("id", thread.path("id").asText(null));
    result.put("snippet", thread.path("snippet").asText(""));
    ArrayNode messages = result.putArray("messages");
    thread.path("messages").forEach(message -> messages.add(toEmail(message)));
    return result;
  }

  /** Plain text part first, then HTML, then the payload's own body. */
  String extractBody(JsonNode payload) {
    String data = findPart(payload, "text/plain");
    if (data == null) {
      data = findPart(payload, "text/html");
    }
    if (data == null) {
      data = bodyData(payload);
    }
    return data != null ? decode(data) : "";
  }

  private String findPart(JsonNode part, String mimeType) {
    if (mimeType.equalsIgnoreCase(part.path("mimeType").asText("")) && bodyData(part) != null) {
      return bodyData(part);
    }
    for (JsonNode child : part.path("parts")) {
      String found = findPart(child, mimeType);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  private String bodyData(JsonNode part) {
    String data = part.path("body").path("data").asText(null);
    return data != null && !data.isEmpty() ? data : null;
  }

  private String decode(String data) {
    try {
      return new String(Base64.getUrlDecoder().decode(data.trim()), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      return "";
    }
  }
}

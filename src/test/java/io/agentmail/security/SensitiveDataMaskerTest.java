package io.agentmail.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmail.model.Attachment;
import io.agentmail.model.AttachmentKind;
import io.agentmail.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class SensitiveDataMaskerTest {

    @Test
    void masksNestedKeysAndOpaqueValues() {
        JsonNode input = Jsons.mapper().valueToTree(Map.of(
                "denied", List.of(Map.of("agent_id", 3, "password", "hunter2")),
                "path_pattern", "src/very/long/path/to/some/module/file_name.py",
                "ref", "a8F3kd92LmQp0ZxYw7Tn4VbR1sHcUe6J"
        ));
        JsonNode masked = SensitiveDataMasker.masked(input);

        Assertions.assertEquals("***", masked.path("denied").get(0).path("password").asText());
        Assertions.assertEquals(3, masked.path("denied").get(0).path("agent_id").asInt());
        Assertions.assertEquals("src/very/long/path/to/some/module/file_name.py", masked.path("path_pattern").asText());
        Assertions.assertEquals("***", masked.path("ref").asText());
    }

    @Test
    void keyHintsAreCaseInsensitive() {
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("Authorization"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("BODY_MD"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("reservation_id"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(""));
    }

    @Test
    void messageBodyKeepsOnlyItsLength() {
        JsonNode masked = SensitiveDataMasker.masked(Jsons.mapper().valueToTree(Map.of(
                "body_md", "ship the migration tonight",
                "subject", "deploy"
        )));
        Assertions.assertEquals("***(26 chars)", masked.path("body_md").asText());
        Assertions.assertEquals("deploy", masked.path("subject").asText());
    }

    @Test
    void attachmentPointersDropPayloadsAndQueryStrings() {
        JsonNode masked = SensitiveDataMasker.masked(Jsons.mapper().valueToTree(Map.of("attachments", List.of(
                Attachment.url("https://files.example.com/report.pdf?sig=abc123&exp=99#page=2"),
                new Attachment("att-2", AttachmentKind.INLINE, "data:text/plain;base64,c2VjcmV0IG5vdGVz", "text/plain", 12L),
                Attachment.file("docs/plan.md", "text/markdown")
        ))));
        JsonNode attachments = masked.path("attachments");
        Assertions.assertEquals("https://files.example.com/report.pdf", attachments.get(0).path("pointer").asText());
        Assertions.assertEquals("data:text/plain;base64,***", attachments.get(1).path("pointer").asText());
        Assertions.assertEquals("att-2", attachments.get(1).path("id").asText());
        Assertions.assertEquals(12, attachments.get(1).path("bytes").asInt());
        Assertions.assertEquals("docs/plan.md", attachments.get(2).path("pointer").asText());
    }

    @Test
    void pointerMaskingByKind() {
        Assertions.assertEquals("https://x.test/a", SensitiveDataMasker.maskPointer(AttachmentKind.URL, "https://x.test/a#frag"));
        Assertions.assertEquals("https://x.test/a", SensitiveDataMasker.maskPointer(AttachmentKind.URL, "https://x.test/a"));
        Assertions.assertEquals("***", SensitiveDataMasker.maskPointer(AttachmentKind.INLINE, "opaque"));
        Assertions.assertNull(SensitiveDataMasker.maskPointer(AttachmentKind.FILE, null));
    }
}

package com.chronicle;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.chronicle.config.Config;
import com.chronicle.config.HookContext;
import com.chronicle.hook.HookResult;
import com.chronicle.response.ExitCode;
import com.chronicle.util.Jsons;

class ChronicleHookTest {

    @TempDir
    Path tempDir;

    private ChronicleHook hook(Properties props, String hookArgument) {
        props.setProperty(Config.LOCAL_DB_PATH, tempDir.resolve("data").resolve("chronicle").toString());
        props.setProperty(Config.LOCAL_AUTO_SERVER, "false");
        props.setProperty(Config.GIT_DETECT_ENABLED, "false");
        return new ChronicleHook(HookContext.builder()
                .config(Config.fromProperties(tempDir, props))
                .hookArgument(hookArgument)
                .build());
    }

    private static InputStream stdin(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testHookNameFromArgument() throws IOException {
        try (ChronicleHook hook = hook(new Properties(), "Notification")) {
            HookResult result = hook.run(stdin("{\"session_id\":\"cli\",\"message\":\"hi\"}"));

            assertEquals(ExitCode.SUCCESS, result.getExitCode());
            Map<String, Object> json = Jsons.toMap(result.getResponse().toJson());
            assertEquals(true, json.get("continue"));
        }
    }

    @Test
    void testOversizedStdin() {
        Properties props = new Properties();
        props.setProperty(Config.INPUT_MAX_BYTES, "64");
        try (ChronicleHook hook = hook(props, null)) {
            HookResult result = hook.run(stdin("{\"hookEventName\":\"UserPromptSubmit\",\"sessionId\":\"big\",\"prompt\":\""
                    + "z".repeat(500) + "\"}"));

            assertEquals(ExitCode.WARNING, result.getExitCode());
            assertTrue(result.getResponse().isContinueExecution());
            assertTrue(result.getResponse().getError().startsWith("too_large"));
        }
    }

    @Test
    void testUnreadableStdin() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("pipe closed");
            }
        };
        try (ChronicleHook hook = hook(new Properties(), null)) {
            HookResult result = hook.run(broken);

            assertTrue(result.getResponse().isContinueExecution());
            assertEquals(ExitCode.WARNING, result.getExitCode());
        }
    }
}

package com.chronicle;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chronicle.config.HookContext;
import com.chronicle.hook.HookProcessor;
import com.chronicle.hook.HookResult;
import com.chronicle.response.ExitCode;
import com.chronicle.response.HookResponse;

/**
 * Process entry point. Reads one JSON document from stdin, writes one to stdout and exits.
 * An optional first argument names the hook when the input does not.
 */
public class ChronicleHook implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ChronicleHook.class);

    private final HookContext context;
    private final HookProcessor processor;

    public ChronicleHook(HookContext context) {
        this.context = context;
        this.processor = HookProcessor.create(context);
    }

    public HookResult run(InputStream in) {
        byte[] raw;
        try {
            long limit = context.getConfig().getInputMaxBytes();
            // One byte past the limit is enough to report too_large.
            raw = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, limit + 1));
        } catch (IOException e) {
            logger.error("Cannot read hook input: {}", e.getMessage());
            return HookResult.failOpen("Cannot read hook input");
        }
        return processor.process(raw);
    }

    @Override
    public void close() {
        processor.close();
        context.close();
    }

    public static void main(String[] args) {
        String hookArgument = args.length > 0 ? args[0] : null;
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        HookResult result;
        try (ChronicleHook hook = new ChronicleHook(HookContext.fromEnvironment(hookArgument))) {
            result = hook.run(System.in);
        } catch (Throwable t) {
            logger.error("Chronicle hook failed", t);
            result = new HookResult(HookResponse.safeDefault("Chronicle hook error - execution continues"),
                    ExitCode.WARNING, "Chronicle hook error: " + t.getClass().getSimpleName());
        }

        out.println(result.getResponse().toJson());
        result.getStderrMessage().ifPresent(System.err::println);
        System.exit(result.getExitCode().getCode());
    }
}

package com.stackfit.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExternalEngineTest {

    @TempDir
    Path dir;

    private ExternalEngine engine(ProcessRunner runner) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("ENGINE_HOME", "/opt/phot");
        env.put("NOTE", "it's");
        return new ExternalEngine("detect", Paths.get("/opt/phot/bin/detect"), "/bin/sh", env, runner,
                Duration.ofSeconds(5));
    }

    @Test
    void writesScriptPassesAnswersAndDeletesScript() {
        FakeProcessRunner runner = new FakeProcessRunner(call -> FakeProcessRunner.ok());
        AnswerSequence answers = new AnswerSequence().line("stack.fits").line("stack.opt");

        ProcessResult r = engine(runner).run(dir, answers);

        assertEquals(0, r.exitCode);
        assertEquals(1, runner.calls().size());
        FakeProcessRunner.Call call = runner.calls().get(0);
        assertEquals("/bin/sh", call.argv.get(0));
        assertEquals(dir.resolve("detect.sh").toString(), call.argv.get(1));
        assertEquals("detect", call.engine());
        assertEquals("stack.fits\nstack.opt\n", call.stdin);
        assertEquals(dir, call.workDir);

        assertNotNull(call.script);
        assertTrue(call.script.startsWith("#!/bin/sh\n"));
        assertTrue(call.script.contains("export ENGINE_HOME='/opt/phot'\n"));
        assertTrue(call.script.contains("export NOTE='it'\\''s'\n"));
        assertTrue(call.script.endsWith("exec '/opt/phot/bin/detect'\n"));
        assertFalse(Files.exists(dir.resolve("detect.sh")));
    }

    @Test
    void scriptIsDeletedWhenTheRunnerFails() {
        FakeProcessRunner runner = new FakeProcessRunner(call -> {
            throw new IOException("no shell");
        });

        ProcessResult r = engine(runner).run(dir, new AnswerSequence().line("stack.fits"));

        assertEquals(-1, r.exitCode);
        assertEquals("no shell", r.stderr);
        assertFalse(Files.exists(dir.resolve("detect.sh")));
    }

    @Test
    void quoteEscapesSingleQuotes() {
        assertEquals("'a b'", ExternalEngine.quote("a b"));
        assertEquals("'x'\\''y'", ExternalEngine.quote("x'y"));
    }
}

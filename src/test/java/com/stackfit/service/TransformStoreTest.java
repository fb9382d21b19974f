package com.stackfit.service;

import com.stackfit.error.ConfigurationException;
import com.stackfit.model.Transform;
import com.stackfit.model.TransformList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransformStoreTest {

    @TempDir
    Path dir;

    private Path write(String name, String... lines) throws IOException {
        Path p = dir.resolve(name);
        Files.write(p, List.of(lines), StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void loadsRowsInOrderWithOptionalColumns() throws IOException {
        Path mch = write("frames.mch",
                " 'f1.als'    0.000    0.000  1.00000  0.00000  0.00000  1.00000",
                " 'f2.als'    3.000   -2.000  1.00000  0.00000  0.00000  1.00000   4.50 extra",
                "",
                " \"f3.als\"  1.500    0.500  1.00000  0.00000  0.00000  1.00000");

        TransformStore store = TransformStore.load(mch);

        assertEquals(3, store.size());
        assertEquals(List.of("f1", "f2", "f3"), store.list().frameIds());
        TransformList.Entry f2 = store.list().get(1);
        assertEquals(4.5, f2.transform.fitRadius, 1e-12);
        assertEquals("extra", f2.trailing);
        assertEquals(0.0, store.transform(2).fitRadius, 1e-12);

        double[] r = store.toReference(1, 0, 0);
        assertEquals(3.0, r[0], 1e-12);
        assertEquals(-2.0, r[1], 1e-12);
        double[] back = store.fromReference(1, r[0], r[1]);
        assertEquals(0.0, back[0], 1e-12);
        assertEquals(0.0, back[1], 1e-12);
    }

    @Test
    void nonNumericSeventhColumnIsKeptAsTrailingText() {
        TransformList.Entry e = TransformStore.parseRow(" 'a.als' 1 2 1 0 0 1 note here", dir, 1);
        assertEquals(0.0, e.transform.fitRadius, 1e-12);
        assertEquals("note here", e.trailing);
        assertEquals("a", e.frameId);
    }

    @Test
    void rejectsReferenceThatIsNotIdentity() throws IOException {
        Path mch = write("bad.mch", " 'f1.als' 1.0 0.0 1 0 0 1");
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> TransformStore.load(mch));
        assertEquals("transforms", e.getStage());
        assertTrue(e.getMessage().contains("f1.als"));
    }

    @Test
    void rejectsSingularTransform() {
        List<TransformList.Entry> entries = List.of(
                new TransformList.Entry("f1.als", Transform.identity(), ""),
                new TransformList.Entry("f2.als", new Transform(0, 0, 1, 2, 1, 2, 0), ""));
        assertThrows(ConfigurationException.class, () -> new TransformStore(new TransformList(entries)));
    }

    @Test
    void rejectsRowWithoutQuotedName() throws IOException {
        Path mch = write("noquote.mch", " f1.als 0 0 1 0 0 1");
        assertThrows(ConfigurationException.class, () -> TransformStore.load(mch));
    }

    @Test
    void rejectsEmptyFile() throws IOException {
        Path mch = write("empty.mch", "");
        assertThrows(ConfigurationException.class, () -> TransformStore.load(mch));
    }

    @Test
    void relativeToStackPutsStackFirstAndShiftsFramesByTrim() {
        TransformStore store = new TransformStore(new TransformList(List.of(
                new TransformList.Entry("f1.als", Transform.identity(), ""),
                new TransformList.Entry("f2.als", Transform.shift(3.0, -2.0), "x"))));

        TransformList fit = store.relativeToStack("stack.als", 2, 1);

        assertEquals(List.of("stack", "f1", "f2"), fit.frameIds());
        assertTrue(fit.reference().transform.isIdentity());
        assertEquals(-2.0, fit.get(1).transform.dx, 1e-12);
        assertEquals(-1.0, fit.get(1).transform.dy, 1e-12);
        assertEquals(1.0, fit.get(2).transform.dx, 1e-12);
        assertEquals(-3.0, fit.get(2).transform.dy, 1e-12);
        assertEquals("x", fit.get(2).trailing);
    }

    @Test
    void writtenListCanBeLoadedBack() throws IOException {
        TransformList list = new TransformList(List.of(
                new TransformList.Entry("f1.als", Transform.identity(), ""),
                new TransformList.Entry("f2.als", new Transform(12.25, -3.5, 0.99998, 0.001, -0.001, 0.99998, 3.2),
                        "")));
        Path out = dir.resolve("out.mch");

        TransformStore.write(list, out);
        TransformStore back = TransformStore.load(out);

        Transform t = back.transform(1);
        assertEquals(12.25, t.dx, 1e-3);
        assertEquals(-3.5, t.dy, 1e-3);
        assertEquals(0.001, t.a21, 1e-5);
        assertEquals(-0.001, t.a12, 1e-5);
        assertEquals(3.2, t.fitRadius, 1e-2);
        assertTrue(Files.readAllLines(out).get(0).startsWith(" 'f1.als'"));
    }
}

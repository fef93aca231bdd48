package io.github.tempo.opt.core.tree;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static io.github.tempo.opt.core.ops.TreeOps.*;
import static org.junit.jupiter.api.Assertions.*;

public class ProgramSnapshotTest {
    @Test
    void testSnapshotKeepsPreImages() {
        Program program = new Program();
        Function f = program.addFunction("f");
        f.setBody(block(eval(extern("io", 3))));
        Function g = program.addFunction("g");
        GlobalVariable counter = program.addGlobal("counter", Literal.of(NumType.I32, 0));
        String printedF = f.toString();

        ProgramSnapshot snapshot = program.beginRecording();
        assertTrue(snapshot.isEmpty());
        program.edit(f);
        f.getBody().children.add(ret());
        program.edit(f);
        program.removeFunction(g);
        program.removeGlobal(counter);
        Function h = program.addFunction("h");
        program.addGlobal("fresh", Literal.TRUE);
        program.endRecording();

        assertFalse(snapshot.isEmpty());
        assertEquals(Collections.singleton(f.getId()), snapshot.editedFunctionIds());
        assertEquals(Collections.singleton(g.getId()), snapshot.removedFunctionIds());
        assertEquals(Collections.singleton(counter.getId()), snapshot.removedGlobalIds());

        assertEquals(printedF, snapshot.function(f.getId()).toString());
        assertNotEquals(printedF, program.function(f.getId()).toString());
        assertSame(g, snapshot.function("g"));
        assertNull(snapshot.function(h.getId()));
        assertNull(snapshot.function("h"));
        assertEquals(2, snapshot.functions().size());
        assertEquals(1, snapshot.globals().size());
        assertSame(counter, snapshot.global(counter.getId()));
    }

    @Test
    void testUntouchedFunctionsAreShared() {
        Program program = new Program();
        Function f = program.addFunction("f");
        ProgramSnapshot snapshot = program.beginRecording();
        program.endRecording();
        assertSame(f, snapshot.function(f.getId()));
        assertTrue(snapshot.isEmpty());
    }

    @Test
    void testAddedThenRemovedLeavesNoTrace() {
        Program program = new Program();
        ProgramSnapshot snapshot = program.beginRecording();
        Function temp = program.addFunction("temp");
        program.edit(temp);
        program.removeFunction(temp);
        program.endRecording();
        assertTrue(snapshot.removedFunctionIds().isEmpty());
        assertTrue(snapshot.editedFunctionIds().isEmpty());
        assertTrue(snapshot.functions().isEmpty());
    }

    @Test
    void testRecordingIsExclusive() {
        Program program = new Program();
        program.beginRecording();
        assertThrows(IllegalStateException.class, program::beginRecording);
        program.endRecording();
        assertThrows(IllegalStateException.class, program::endRecording);
    }
}

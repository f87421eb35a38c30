package io.github.shadeir.core.test;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.Ext;
import io.github.shadeir.core.ext.ExtHolder;
import io.github.shadeir.core.ext.MetadataState;
import io.github.shadeir.core.ssa.BasicBlock;
import io.github.shadeir.core.ssa.Function;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ExtHolderTest {
    private static final Ext<String> NAME = Ext.create(String.class, "NAME");
    private static final Ext<Integer> WEIGHT = Ext.create(Integer.class, "WEIGHT");

    @Test
    void testAttachAndRemove() {
        ExtHolder eh = new ExtHolder();
        assertNull(eh.getNullable(NAME));
        assertEquals(Optional.empty(), eh.getExt(NAME));

        eh.attachExt(NAME, "a");
        eh.attachExt(WEIGHT, 3);
        assertEquals("a", eh.getExtOrThrow(NAME));
        assertEquals(Optional.of(3), WEIGHT.getIn(eh));

        eh.removeExt(NAME);
        assertNull(eh.getNullable(NAME));
        assertEquals(Integer.valueOf(3), eh.getNullable(WEIGHT));
        eh.removeExt(WEIGHT);
        eh.removeExt(WEIGHT);
        assertNull(eh.getNullable(WEIGHT));
    }

    @Test
    void testMissingExtThrows() {
        RuntimeException e = assertThrows(RuntimeException.class, () -> new ExtHolder().getExtOrThrow(NAME));
        assertEquals("Ext not present: NAME", e.getMessage());
    }

    @Test
    void testFieldBackedExts() {
        Function func = new Function("f");
        BasicBlock bb = func.newBb();
        assertSame(func, bb.getExtOrThrow(CommonExts.OWNING_FUNCTION));
        assertNotNull(func.getNullable(CommonExts.METADATA_STATE));

        bb.attachExt(NAME, "bb");
        bb.removeExt(CommonExts.OWNING_FUNCTION);
        assertNull(bb.getNullable(CommonExts.OWNING_FUNCTION));
        assertEquals("bb", bb.getExtOrThrow(NAME));

        MetadataState ms = new MetadataState();
        func.attachExt(CommonExts.METADATA_STATE, ms);
        assertSame(ms, func.getExtOrThrow(CommonExts.METADATA_STATE));
    }

    @Test
    void testMetadataState() {
        MetadataState ms = new MetadataState();
        assertFalse(ms.isValid(MetadataState.PREDS));
        ms.validate(MetadataState.PREDS, MetadataState.DOMS);
        assertTrue(ms.isValid(MetadataState.PREDS));
        ms.invalidate(MetadataState.PREDS);
        assertFalse(ms.isValid(MetadataState.PREDS));
        assertTrue(ms.isValid(MetadataState.DOMS));
        ms.graphChanged();
        assertFalse(ms.isValid(MetadataState.DOMS));
    }
}

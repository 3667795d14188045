package com.questrail.options.codec;

import com.questrail.options.api.Addition;
import com.questrail.options.api.EnumDescriptor;
import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.UnsupportedOptionOperationException;
import com.questrail.options.model.DebugFlags;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class EnumAndFlagsCodecTest
{
    enum TestFlag { HOOKS, SHELL }

    enum Mode { INSERT, NORMAL }

    private static final EnumDescriptor<TestFlag> TEST_FLAGS =
            EnumDescriptor.flags(TestFlag.class)
                    .add(TestFlag.HOOKS, "hooks")
                    .add(TestFlag.SHELL, "shell")
                    .build();

    private static final EnumDescriptor<Mode> MODES =
            EnumDescriptor.plain(Mode.class)
                    .add(Mode.INSERT, "insert")
                    .add(Mode.NORMAL, "normal")
                    .build();

    // ---------------------------------------------------------------------
    // Flags
    // ---------------------------------------------------------------------

    @Test
    void flagTypeNameListsNamesInOrder() {
        assertEquals("flags(hooks|shell)", OptionCodecs.flagsOf(TEST_FLAGS).typeName());
        assertEquals("flags(hooks|shell|profile|keys)", OptionCodecs.flagsOf(DebugFlags.DESCRIPTOR).typeName());
    }

    @Test
    void flagsRenderInDescriptorOrder() {
        FlagsCodec<DebugFlags> codec = OptionCodecs.flagsOf(DebugFlags.DESCRIPTOR);

        assertEquals("shell|keys", codec.toText(EnumSet.of(DebugFlags.KEYS, DebugFlags.SHELL)));
        assertEquals("", codec.toText(EnumSet.noneOf(DebugFlags.class)));
    }

    @Test
    void undescribedFlagIsRejectedOnEncode() {
        EnumDescriptor<TestFlag> hooksOnly = EnumDescriptor.flags(TestFlag.class)
                .add(TestFlag.HOOKS, "hooks")
                .build();
        FlagsCodec<TestFlag> codec = OptionCodecs.flagsOf(hooksOnly);

        assertEquals("hooks", codec.toText(EnumSet.of(TestFlag.HOOKS)));
        assertThrows(IllegalArgumentException.class,
                () -> codec.toText(EnumSet.of(TestFlag.HOOKS, TestFlag.SHELL)));
    }

    @Test
    void flagsDecodeInAnyOrder() {
        FlagsCodec<DebugFlags> codec = OptionCodecs.flagsOf(DebugFlags.DESCRIPTOR);

        assertEquals(EnumSet.of(DebugFlags.HOOKS, DebugFlags.PROFILE), codec.fromText("profile|hooks"));
        assertTrue(codec.fromText("").isEmpty());
    }

    @Test
    void unknownFlagIsRejected() {
        FlagsCodec<DebugFlags> codec = OptionCodecs.flagsOf(DebugFlags.DESCRIPTOR);

        InvalidOptionFormatException e =
                assertThrows(InvalidOptionFormatException.class, () -> codec.fromText("hooks|bogus"));
        assertEquals("invalid flag value 'bogus'", e.getMessage());
        assertThrows(InvalidOptionFormatException.class, () -> codec.fromText("Hooks"));
    }

    @Test
    void flagAddIsUnion() {
        FlagsCodec<DebugFlags> codec = OptionCodecs.flagsOf(DebugFlags.DESCRIPTOR);

        Addition<Set<DebugFlags>> result = codec.add(EnumSet.of(DebugFlags.HOOKS), "keys|hooks");
        assertTrue(result.changed());
        assertEquals(EnumSet.of(DebugFlags.HOOKS, DebugFlags.KEYS), result.value());

        assertFalse(codec.add(EnumSet.of(DebugFlags.HOOKS), "").changed());
    }

    @Test
    void flagsCodecNeedsFlagDescriptor() {
        assertThrows(IllegalArgumentException.class, () -> OptionCodecs.flagsOf(MODES));
    }

    // ---------------------------------------------------------------------
    // Plain enums
    // ---------------------------------------------------------------------

    @Test
    void enumRoundTrip() {
        EnumCodec<Mode> codec = OptionCodecs.enumOf(MODES);

        assertEquals("enum(insert|normal)", codec.typeName());
        assertEquals("normal", codec.toText(Mode.NORMAL));
        assertEquals(Mode.INSERT, codec.fromText("insert"));
    }

    @Test
    void unknownEnumValueIsRejected() {
        EnumCodec<Mode> codec = OptionCodecs.enumOf(MODES);

        InvalidOptionFormatException e =
                assertThrows(InvalidOptionFormatException.class, () -> codec.fromText("visual"));
        assertEquals("invalid enum value 'visual', expected one of insert|normal", e.getMessage());
        assertThrows(InvalidOptionFormatException.class, () -> codec.fromText("insert|normal"));
    }

    @Test
    void enumsHaveNoAdd() {
        assertThrows(UnsupportedOptionOperationException.class,
                () -> OptionCodecs.enumOf(MODES).add(Mode.INSERT, "normal"));
    }

    @Test
    void enumCodecNeedsPlainDescriptor() {
        assertThrows(IllegalArgumentException.class, () -> OptionCodecs.enumOf(TEST_FLAGS));
    }
}

package com.williamcallahan.notesrender.service.math;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SymbolTablesTest {

    @Test
    void toSuperscript_mapsKnownCharactersAndKeepsOthers() {
        assertEquals("²ⁿ", SymbolTables.toSuperscript("2n"));
        assertEquals("ᵃq", SymbolTables.toSuperscript("aq"));
    }

    @Test
    void toSubscript_keepsLettersWithoutSubscriptForm() {
        assertEquals("ᵢ₌₁", SymbolTables.toSubscript("i=1"));
        assertEquals("q", SymbolTables.toSubscript("q"));
        assertEquals("", SymbolTables.toSubscript(""));
    }

    @Test
    void symbolCommands_areOrderedLongestFirst() {
        List<String> commands = SymbolTables.SYMBOL_COMMANDS_LONGEST_FIRST;

        assertEquals(SymbolTables.SYMBOLS.size(), commands.size());
        assertTrue(commands.indexOf("\\infty") < commands.indexOf("\\in"));
        assertTrue(commands.indexOf("\\leq") < commands.indexOf("\\le"));
        for (int i = 1; i < commands.size(); i++) {
            assertTrue(commands.get(i - 1).length() >= commands.get(i).length(), "Out of order at " + commands.get(i));
        }
    }

    @Test
    void greekAndSymbolTables_doNotOverlap() {
        for (String command : SymbolTables.GREEK.keySet()) {
            assertFalse(SymbolTables.SYMBOLS.containsKey(command), "Duplicate command " + command);
            assertTrue(command.startsWith("\\"));
        }
    }

    @Test
    void tables_areImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> SymbolTables.GREEK.put("\\foo", "f"));
        assertThrows(UnsupportedOperationException.class, () -> SymbolTables.SYMBOLS.remove("\\cdot"));
        assertThrows(UnsupportedOperationException.class, () -> SymbolTables.SYMBOL_COMMANDS_LONGEST_FIRST.clear());
    }
}

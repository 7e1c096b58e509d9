package com.specguard.core.analyzer;

import java.util.Locale;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeInferenceTest {

    @Test
    void testCollectionWordsTakePriority() {
        assertEquals("list[str]", TypeInference.infer("Split the sentence into words", "words"));
        assertEquals("list[int]", TypeInference.infer("Collect every index into a list", "list"));
        assertEquals("list[Any]", TypeInference.infer("Gather the items", ""));
    }

    @Test
    void testScalarGroupsInOrder() {
        assertEquals("int", TypeInference.infer("Store the number of hits", null));
        assertEquals("bool", TypeInference.infer("Set flag to true", ""));
        assertEquals("dict", TypeInference.infer("Build a dictionary of names", ""));
    }

    @Test
    void testWholeWordsOnly() {
        // "interval" must not match "int", "restore" must not match "str"
        assertEquals("Any", TypeInference.infer("Restore the interval", ""));
    }

    @Test
    void testUpperCaseWordingUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("int", TypeInference.infer("STORE THE INDEX", ""));
            assertEquals("list[str]", TypeInference.infer("SPLIT INTO STRINGS", ""));
        } finally {
            Locale.setDefault(previous);
        }
    }
}

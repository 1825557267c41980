package com.ndf.cnl.io;

import org.junit.Test;

import static org.junit.Assert.*;

public class CnlRendererTest {

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    private static final String CHEMISTRY = lines(
            "Chemistry.",
            "# Hydrogen [Element]",
            "<part of> Water, Ocean;",
            "has number of protons: 1;",
            "## Hydrogen ion",
            "has charge: +1;",
            "# Water");

    @Test
    public void testNormalizedLayout() {
        String expected = "Chemistry.\n"
                + "\n"
                + "# Hydrogen [Element]\n"
                + "has number of protons: 1;\n"
                + "<part of> Water;\n"
                + "<part of> Ocean;\n"
                + "\n"
                + "## Hydrogen ion\n"
                + "has charge: +1;\n"
                + "\n"
                + "# Water\n";
        assertEquals(expected, CnlRenderer.normalize(CHEMISTRY));
    }

    @Test
    public void testNormalizeIsIdempotent() {
        String once = CnlRenderer.normalize(CHEMISTRY);
        assertEquals(once, CnlRenderer.normalize(once));
    }

    @Test
    public void testMarkersAndDescriptionsSurvive() {
        String text = lines(
                "# **female** Mathematician [Person]",
                ":::description",
                "Works on number theory.",
                ":::",
                "has *many* **famous** result: proofs *pages* [probably];",
                "++often++ **close** <works with> *several* Colleague [maybe];");
        String out = CnlRenderer.normalize(text);
        assertTrue(out.startsWith("# **female** Mathematician [Person]\n:::description\nWorks on number theory.\n:::\n"));
        assertTrue(out.contains("has *many* **famous** result: proofs *pages* [probably];\n"));
        assertTrue(out.contains("++often++ **close** <works with> *several* Colleague [maybe];\n"));
        assertEquals(out, CnlRenderer.normalize(out));
    }

    @Test
    public void testTransitionStatesRendered() {
        String text = lines(
                "# Fuel", "# Spark", "# Flame", "# Heat",
                "# Combustion [Transition]",
                "priorState: Fuel, Spark | Flame;",
                "postState: Heat;");
        String out = CnlRenderer.normalize(text);
        assertTrue(out.contains("# Combustion [Transition]\npriorState: Fuel, Spark|Flame\npostState: Heat\n"));
        assertEquals(out, CnlRenderer.normalize(out));
    }

    @Test
    public void testImplicitTargetsAreNotWritten() {
        String out = CnlRenderer.normalize(lines("# Hydrogen", "<part of> Water;"));
        assertEquals("# Hydrogen\n<part of> Water;\n", out);
    }

    @Test
    public void testEmptyText() {
        assertEquals("", CnlRenderer.normalize(""));
    }
}

package com.ndf.cnl.io;

import com.ndf.cnl.engine.IdentityResolver;
import com.ndf.cnl.model.GraphSnapshot;
import com.ndf.cnl.model.LogicalOperatorNode;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;

import static org.junit.Assert.*;

public class SnapshotCodecTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static GraphSnapshot sample() {
        StructuralTree tree = new CnlParser().parse(String.join("\n",
                "Reactions.",
                "# Fuel", "# Spark", "# Flame",
                "# Water",
                "has state: liquid;",
                "## Vapor",
                "has state: gas;",
                "# Combustion [Transition]",
                "priorState: Fuel, Spark | Flame",
                "postState: Water:vapor"));
        return IdentityResolver.resolve(tree).toSnapshot(tree.getDescription());
    }

    @Test
    public void testJsonKeepsStateEntryKinds() {
        String json = SnapshotCodec.toJson(sample());
        assertTrue(json.contains("\"kind\" : \"logic\""));
        assertTrue(json.contains("\"kind\" : \"ref\""));

        GraphSnapshot back = SnapshotCodec.fromJson(json);
        assertEquals(sample(), back);
        assertTrue(back.transitionOf("combustion").priorState().get(1) instanceof LogicalOperatorNode);
    }

    @Test
    public void testFileRoundTripRendersTheSame() throws Exception {
        Path file = tmp.newFile("graph.json").toPath();
        SnapshotCodec.write(sample(), file);
        assertEquals(CnlRenderer.render(sample()), CnlRenderer.render(SnapshotCodec.read(file)));
    }
}

package org.repcluster.serialization.flexbuffers;

import com.google.flatbuffers.FlexBuffersBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.repcluster.clustering.core.ClusteringConfig;
import org.repcluster.clustering.pipeline.PipelineResult;
import org.repcluster.clustering.pipeline.PipelineRunContext;
import org.repcluster.clustering.pipeline.RepresentativePeriodPipeline;
import org.repcluster.clustering.testutil.ProfileFixtures;
import org.repcluster.clustering.weight.WeightPolicy;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Representative Period Artifact Codec Tests")
class RepresentativePeriodArtifactCodecTest {

    private static RepresentativePeriodArtifact pipelineArtifact() {
        ClusteringConfig config = ClusteringConfig.builder()
                .representativePeriods(3)
                .weightPolicy(WeightPolicy.CONVEX)
                .build();
        PipelineResult result = new RepresentativePeriodPipeline().run(
                ProfileFixtures.threeShapeYear(12, 4L),
                new PipelineRunContext("artifact-run", config)
        );
        return RepresentativePeriodArtifact.builder()
                .runId(result.getRunId())
                .periodDuration(24)
                .numRepresentativePeriods(3)
                .distanceMetric(result.getClustering().distanceMetricId())
                .converged(result.getClustering().converged())
                .tables(result.getExportTables())
                .build();
    }

    @Test
    @DisplayName("Decoded artifact equals the encoded pipeline output")
    void testEncodeDecode() {
        RepresentativePeriodArtifact artifact = pipelineArtifact();

        RepresentativePeriodArtifact decoded = RepresentativePeriodArtifactCodec.decode(
                RepresentativePeriodArtifactCodec.encode(artifact)
        );

        assertEquals(artifact, decoded);
        assertEquals("artifact-run", decoded.getRunId());
        assertEquals("EUCLIDEAN", decoded.getDistanceMetric());
    }

    @Test
    @DisplayName("Foreign identifier and unsupported schema version are rejected")
    void testHeaderContract() {
        FlexBuffersBuilder foreign = new FlexBuffersBuilder();
        int root = foreign.startMap();
        foreign.putString("file_identifier", "XXXX");
        foreign.putInt("schema_version", 1);
        foreign.endMap(null, root);
        IllegalArgumentException identifier = assertThrows(
                IllegalArgumentException.class,
                () -> RepresentativePeriodArtifactCodec.decode(toBytes(foreign.finish()))
        );
        assertTrue(identifier.getMessage().contains("file_identifier"));

        FlexBuffersBuilder future = new FlexBuffersBuilder();
        root = future.startMap();
        future.putString("file_identifier", ArtifactContractValidator.FILE_IDENTIFIER);
        future.putInt("schema_version", 2);
        future.endMap(null, root);
        IllegalArgumentException version = assertThrows(
                IllegalArgumentException.class,
                () -> RepresentativePeriodArtifactCodec.decode(toBytes(future.finish()))
        );
        assertTrue(version.getMessage().contains("unsupported schema_version 2"));
    }

    @Test
    @DisplayName("Missing tables and empty input are rejected")
    void testMissingContent() {
        FlexBuffersBuilder headerOnly = new FlexBuffersBuilder();
        int root = headerOnly.startMap();
        headerOnly.putString("file_identifier", ArtifactContractValidator.FILE_IDENTIFIER);
        headerOnly.putInt("schema_version", 1);
        headerOnly.endMap(null, root);

        IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> RepresentativePeriodArtifactCodec.decode(toBytes(headerOnly.finish()))
        );
        assertTrue(ex.getMessage().contains("rep_periods_data missing"));
        assertThrows(IllegalArgumentException.class, () -> RepresentativePeriodArtifactCodec.decode(new byte[0]));
    }

    private static byte[] toBytes(ByteBuffer buffer) {
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }
}

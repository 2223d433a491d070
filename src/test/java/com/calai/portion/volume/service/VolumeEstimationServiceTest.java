package com.calai.portion.volume.service;

import com.calai.portion.volume.config.VolumeEstimationProperties;
import com.calai.portion.volume.density.InMemoryFoodDensityRepository;
import com.calai.portion.volume.depth.DepthEstimator;
import com.calai.portion.volume.exception.InvalidEstimationInputException;
import com.calai.portion.volume.geometry.VolumeCalculator;
import com.calai.portion.volume.model.BoundingBox;
import com.calai.portion.volume.model.DepthEstimate;
import com.calai.portion.volume.model.EstimationMethod;
import com.calai.portion.volume.model.FoodCategory;
import com.calai.portion.volume.model.FoodClassification;
import com.calai.portion.volume.model.FoodDensityEntry;
import com.calai.portion.volume.model.FoodShape;
import com.calai.portion.volume.model.ImageSource;
import com.calai.portion.volume.model.ReferenceObject;
import com.calai.portion.volume.model.VolumeEstimationResult;
import com.calai.portion.volume.reference.ReferenceObjectDetector;
import com.calai.portion.volume.shape.ShapeAnalyzer;
import com.calai.portion.volume.telemetry.EstimationTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class VolumeEstimationServiceTest {

    private static final ImageSource IMAGE = ImageSource.of("img-apple", 640, 480);
    /** 200×180：長寬比 1.11 -> spherical */
    private static final BoundingBox APPLE_BOX = new BoundingBox(100, 150, 200, 180);

    private static final ReferenceObject CREDIT_CARD = new ReferenceObject(
            "Credit Card",
            new ReferenceObject.RealWorldSize(8.56, 5.398),
            new ReferenceObject.PixelSize(80, 50),
            0.8
    );

    private ReferenceObjectDetector detector;
    private DepthEstimator depthEstimator;
    private EstimationTelemetry telemetry;
    private InMemoryFoodDensityRepository densities;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        detector = mock(ReferenceObjectDetector.class);
        depthEstimator = mock(DepthEstimator.class);
        telemetry = mock(EstimationTelemetry.class);

        when(detector.detect(any())).thenReturn(List.of());
        when(depthEstimator.estimate(any(), any())).thenReturn(DepthEstimate.none());

        densities = new InMemoryFoodDensityRepository(Map.of(
                "Apple", new FoodDensityEntry(0.85, 0.10, FoodShape.SPHERICAL, 0.10),
                "Bread", new FoodDensityEntry(0.40, 0.10, FoodShape.RECTANGULAR, 0.60)
        ));
    }

    @AfterEach
    void tearDown() {
        if (pool != null) pool.shutdownNow();
    }

    private VolumeEstimationService service(Executor executor, Duration timeout) {
        VolumeEstimationProperties props = new VolumeEstimationProperties();
        props.setEvidenceTimeout(timeout);
        return new VolumeEstimationService(detector, depthEstimator, new ShapeAnalyzer(), new VolumeCalculator(),
                densities, executor, props, telemetry);
    }

    private VolumeEstimationService service() {
        return service(Runnable::run, Duration.ofSeconds(1));
    }

    @Test
    void apple_without_evidence_uses_heuristic() {
        VolumeEstimationResult r = service().estimate(IMAGE,
                new FoodClassification("Apple", FoodCategory.FRUITS, 0.93), APPLE_BOX);

        assertThat(r).isInstanceOf(VolumeEstimationResult.HeuristicEstimate.class);
        assertThat(r.method()).isEqualTo(EstimationMethod.ML_ESTIMATION);
        assertThat(r.method().code()).isEqualTo("ml_estimation");
        assertThat(r.foodName()).isEqualTo("Apple");
        assertThat(r.shapeAnalysis().shape()).isEqualTo(FoodShape.SPHERICAL);
        // √36000 × 0.5 × 10 = 948.68
        assertThat(r.estimatedVolume()).isEqualTo(949);
        assertThat(r.estimatedWeight()).isEqualTo(806);
        assertThat(r.confidence()).isEqualTo(0.6);
        assertThat(r.densityEntry().density()).isEqualTo(0.85);
        assertThat(r.boundingBox()).isEqualTo(APPLE_BOX);

        verify(telemetry).estimated(same(r), eq(FoodCategory.FRUITS), eq("img-apple"), eq(0), eq(false), anyLong());
    }

    @Test
    void credit_card_in_frame_uses_reference_scale() {
        when(detector.detect(IMAGE)).thenReturn(List.of(CREDIT_CARD));

        VolumeEstimationResult r = service().estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX);

        assertThat(r).isInstanceOf(VolumeEstimationResult.ReferenceObjectEstimate.class);
        assertThat(r.method().code()).isEqualTo("reference_object");
        assertThat(r.confidence()).isCloseTo(0.72, within(1e-9));
        assertThat(((VolumeEstimationResult.ReferenceObjectEstimate) r).referenceObject()).isEqualTo(CREDIT_CARD);

        // scale = (8.56/80 + 5.398/50) / 2 = 0.10748
        double realH = 180 * 0.10748;
        double volume = VolumeCalculator.spherical(realH / 2.0);
        assertThat(r.estimatedVolume()).isEqualTo(Math.round(volume));
        assertThat(r.estimatedWeight()).isEqualTo(Math.round(volume * 0.85));

        assertThat(r.shapeAnalysis().dimensions().length()).isCloseTo(21.496, within(1e-9));
        assertThat(r.shapeAnalysis().dimensions().width()).isCloseTo(19.3464, within(1e-9));
        assertThat(r.shapeAnalysis().dimensions().height()).isCloseTo(19.3464 * 0.8, within(1e-9));
    }

    @Test
    void reference_beats_depth_and_best_reference_wins() {
        ReferenceObject weakCoin = new ReferenceObject("Coin",
                new ReferenceObject.RealWorldSize(2.4, 2.4), new ReferenceObject.PixelSize(24, 24), 0.5);
        when(detector.detect(IMAGE)).thenReturn(List.of(weakCoin, CREDIT_CARD));
        when(depthEstimator.estimate(any(), any())).thenReturn(DepthEstimate.of(6.0, 0.2));

        VolumeEstimationResult r = service().estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX);

        assertThat(r.method()).isEqualTo(EstimationMethod.REFERENCE_OBJECT);
        assertThat(((VolumeEstimationResult.ReferenceObjectEstimate) r).referenceObject().name()).isEqualTo("Credit Card");
    }

    @Test
    void unusable_reference_is_ignored() {
        ReferenceObject broken = new ReferenceObject("Credit Card",
                new ReferenceObject.RealWorldSize(8.56, 5.398), new ReferenceObject.PixelSize(0, 50), 0.9);
        when(detector.detect(IMAGE)).thenReturn(List.of(broken));

        VolumeEstimationResult r = service().estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX);
        assertThat(r.method()).isEqualTo(EstimationMethod.ML_ESTIMATION);
    }

    @Test
    void depth_without_reference_uses_depth_as_height() {
        DepthEstimate depth = DepthEstimate.of(6.0, 0.4);
        when(depthEstimator.estimate(IMAGE, APPLE_BOX)).thenReturn(depth);

        VolumeEstimationResult r = service().estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX);

        assertThat(r).isInstanceOf(VolumeEstimationResult.DepthAnalysisEstimate.class);
        assertThat(r.method().code()).isEqualTo("3d_analysis");
        assertThat(r.confidence()).isEqualTo(0.85);
        assertThat(((VolumeEstimationResult.DepthAnalysisEstimate) r).depthEstimation()).isEqualTo(depth);

        // dims = (20, 18, 6)，球的直徑受深度限制 -> 6
        double volume = VolumeCalculator.spherical(3.0);
        assertThat(r.estimatedVolume()).isEqualTo(Math.round(volume));
        assertThat(r.estimatedWeight()).isEqualTo(Math.round(volume * 0.85));
    }

    @Test
    void confidence_follows_evidence_strength() {
        ReferenceObject sureCard = new ReferenceObject("Credit Card",
                new ReferenceObject.RealWorldSize(8.56, 5.398), new ReferenceObject.PixelSize(80, 50), 1.0);
        VolumeEstimationService svc = service();

        when(detector.detect(IMAGE)).thenReturn(List.of(sureCard));
        double ref = svc.estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX).confidence();

        when(detector.detect(IMAGE)).thenReturn(List.of());
        when(depthEstimator.estimate(any(), any())).thenReturn(DepthEstimate.of(5.0, 0.0));
        double depth = svc.estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX).confidence();

        when(depthEstimator.estimate(any(), any())).thenReturn(DepthEstimate.none());
        double heuristic = svc.estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX).confidence();

        assertThat(ref).isGreaterThan(depth);
        assertThat(depth).isGreaterThan(heuristic);
    }

    @Test
    void weight_is_volume_times_density_on_every_path() {
        VolumeEstimationService svc = service();
        BoundingBox breadBox = new BoundingBox(0, 0, 150, 100); // 1.5 -> 用 prior（rectangular）

        VolumeEstimationResult h = svc.withHeuristic("Bread", breadBox,
                new ShapeAnalyzer().analyze(breadBox, FoodShape.RECTANGULAR), densities.lookup("Bread"));
        double raw = VolumeEstimationService.heuristicVolume(breadBox, h.shapeAnalysis());
        assertThat(h.shapeAnalysis().shape()).isEqualTo(FoodShape.RECTANGULAR);
        assertThat(h.estimatedWeight()).isEqualTo(Math.round(raw * 0.40));

        when(depthEstimator.estimate(any(), any())).thenReturn(DepthEstimate.of(4.0, 0.0));
        VolumeEstimationResult d = svc.estimate(IMAGE, "Bread", FoodCategory.GRAINS, breadBox);
        double depthVolume = VolumeCalculator.rectangular(15.0, 10.0, 4.0);
        assertThat(d.estimatedVolume()).isEqualTo(600);
        assertThat(d.estimatedWeight()).isEqualTo(Math.round(depthVolume * 0.40));
    }

    @Test
    void unknown_food_falls_back_to_water_density() {
        VolumeEstimationResult r = service().estimate(IMAGE, "Dragonfruit Bowl", null, APPLE_BOX);

        assertThat(r.densityEntry()).isEqualTo(FoodDensityEntry.DEFAULT);
        assertThat(r.estimatedWeight()).isEqualTo(r.estimatedVolume());
        verify(telemetry).estimated(same(r), eq(FoodCategory.OTHER), any(), anyInt(), anyBoolean(), anyLong());
    }

    @Test
    void unknown_bread_and_cheese_keep_rectangular_shape() {
        VolumeEstimationService svc = service();
        BoundingBox slice = new BoundingBox(0, 0, 150, 100); // 1.5

        for (String name : new String[]{"Sliced Bread", "Whole Wheat Bread", "Cheddar Cheese"}) {
            VolumeEstimationResult r = svc.estimate(IMAGE, name, FoodCategory.GRAINS, slice);

            assertThat(r.shapeAnalysis().shape()).as(name).isEqualTo(FoodShape.RECTANGULAR);
            // √15000 × 0.8 × 10 = 979.8
            assertThat(r.estimatedVolume()).as(name).isEqualTo(980);
            assertThat(r.densityEntry()).isEqualTo(FoodDensityEntry.DEFAULT);
        }

        assertThat(svc.estimate(IMAGE, "Mango", FoodCategory.FRUITS, slice).shapeAnalysis().shape())
                .isEqualTo(FoodShape.IRREGULAR);
    }

    @Test
    void food_name_lookup_is_case_insensitive() {
        VolumeEstimationResult r = service().estimate(IMAGE, "  apple ", FoodCategory.FRUITS, APPLE_BOX);
        assertThat(r.densityEntry().density()).isEqualTo(0.85);
    }

    @Test
    void failing_evidence_sources_degrade_to_heuristic() {
        when(detector.detect(any())).thenThrow(new IllegalStateException("DETECTOR_CRASHED"));
        when(depthEstimator.estimate(any(), any())).thenThrow(new IllegalStateException("DEPTH_CRASHED"));

        VolumeEstimationResult r = service().estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX);

        assertThat(r.method()).isEqualTo(EstimationMethod.ML_ESTIMATION);
        assertThat(r.estimatedVolume()).isEqualTo(949);
        verify(telemetry).evidenceFailed(eq("REFERENCE"), eq("img-apple"), contains("DETECTOR_CRASHED"));
        verify(telemetry).evidenceFailed(eq("DEPTH"), eq("img-apple"), contains("DEPTH_CRASHED"));
    }

    @Test
    void slow_evidence_is_abandoned_after_timeout() {
        pool = Executors.newFixedThreadPool(2);
        when(detector.detect(any())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return List.of(CREDIT_CARD);
        });
        when(depthEstimator.estimate(any(), any())).thenReturn(DepthEstimate.of(6.0, 0.0));

        long t0 = System.nanoTime();
        VolumeEstimationResult r = service(pool, Duration.ofMillis(200))
                .estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX);
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;

        // 參考物來不及，但深度有回來
        assertThat(r.method()).isEqualTo(EstimationMethod.DEPTH_ANALYSIS);
        assertThat(elapsedMs).isLessThan(3_000);
        verify(telemetry).evidenceFailed("REFERENCE", "img-apple", "TIMEOUT");
    }

    @Test
    void saturated_executor_drops_evidence_instead_of_running_inline() {
        Executor full = task -> {
            throw new RejectedExecutionException("queue full");
        };

        VolumeEstimationResult r = service(full, Duration.ofSeconds(1))
                .estimate(IMAGE, "Apple", FoodCategory.FRUITS, APPLE_BOX);

        assertThat(r.method()).isEqualTo(EstimationMethod.ML_ESTIMATION);
        verify(telemetry).evidenceFailed("REFERENCE", "img-apple", "REJECTED");
        verify(telemetry).evidenceFailed("DEPTH", "img-apple", "REJECTED");
        verifyNoInteractions(detector, depthEstimator);
    }

    @Test
    void contract_violations_are_rejected() {
        VolumeEstimationService svc = service();

        assertThatThrownBy(() -> svc.estimate(null, "Apple", FoodCategory.FRUITS, APPLE_BOX))
                .isInstanceOf(InvalidEstimationInputException.class)
                .hasMessage("IMAGE_REQUIRED");
        assertThatThrownBy(() -> svc.estimate(IMAGE, " ", FoodCategory.FRUITS, APPLE_BOX))
                .isInstanceOf(InvalidEstimationInputException.class)
                .hasMessage("FOOD_NAME_REQUIRED");
        assertThatThrownBy(() -> svc.estimate(IMAGE, (FoodClassification) null, APPLE_BOX))
                .isInstanceOf(InvalidEstimationInputException.class)
                .hasMessage("FOOD_NAME_REQUIRED");
        assertThatThrownBy(() -> svc.estimate(IMAGE, "Apple", FoodCategory.FRUITS, null))
                .isInstanceOf(InvalidEstimationInputException.class)
                .hasMessage("BOUNDING_BOX_REQUIRED");
        assertThatThrownBy(() -> new BoundingBox(0, 0, 0, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("BOUNDING_BOX_INVALID");

        verifyNoInteractions(detector, depthEstimator);
    }
}

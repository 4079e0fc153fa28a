package org.netcoord.runtime.models;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.netcoord.runtime.internal.services.SeededRandomProvider;
import org.netcoord.runtime.model.LinkState;
import org.netcoord.runtime.model.ModelSpec;
import org.netcoord.runtime.model.Position;
import org.netcoord.runtime.registry.CapabilityRegistry;
import org.netcoord.runtime.spi.IFadingModel;
import org.netcoord.runtime.spi.IMobilityModel;
import org.netcoord.test.utils.ConstantFadingModel;
import org.netcoord.test.utils.ScriptedSimulator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
@DisplayName("ModelResolver")
class ModelResolverTest {

    private static final LinkState LINK = new LinkState("c0", 1, 10.0, 5.0);

    private ModelResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ModelResolver(new CapabilityRegistry(new SeededRandomProvider(7L)));
    }

    private static Config params(Map<String, Object> values) {
        return ConfigFactory.parseMap(values);
    }

    @Nested
    @DisplayName("Built-in aliases")
    class BuiltinAliases {

        @Test
        @DisplayName("Rician uses defaults when parameters are omitted")
        void rician_defaults() {
            IFadingModel model = resolver.resolveFading(ModelSpec.of("c0", "rician", ConfigFactory.empty()));

            assertThat(model).isInstanceOf(RicianFadingModel.class);
            RicianFadingModel rician = (RicianFadingModel) model;
            assertThat(rician.getKFactor()).isEqualTo(5.0);
            assertThat(rician.getSigma()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Rayleigh and Nakagami read their parameters")
        void rayleighAndNakagami_readParameters() {
            IFadingModel rayleigh = resolver.resolveFading(ModelSpec.of("c0", "rayleigh", params(Map.of("sigma", 3.0))));
            IFadingModel nakagami = resolver.resolveFading(
                    ModelSpec.of("c1", "nakagami", params(Map.of("m_factor", 2.0, "omega", 1.5))));

            assertThat(((RayleighFadingModel) rayleigh).getSigma()).isEqualTo(3.0);
            assertThat(((NakagamiFadingModel) nakagami).getMFactor()).isEqualTo(2.0);
            assertThat(((NakagamiFadingModel) nakagami).getOmega()).isEqualTo(1.5);
            assertThat(nakagami.sample(LINK)).isFinite();
        }

        @Test
        @DisplayName("Random walk moves at most step_size * dt per axis")
        void randomWalk_staysWithinStep() {
            IMobilityModel model = resolver.resolveMobility(
                    ModelSpec.of("a1", "random_walk", params(Map.of("step_size", 2.0))));

            Position position = Position.ORIGIN;
            for (int i = 0; i < 50; i++) {
                Position next = model.advance(position, 0.5);
                assertThat(Math.abs(next.x() - position.x())).isLessThanOrEqualTo(1.0);
                assertThat(Math.abs(next.y() - position.y())).isLessThanOrEqualTo(1.0);
                position = next;
            }
        }

        @Test
        @DisplayName("A zero step size never moves")
        void randomWalk_zeroStep() {
            IMobilityModel model = resolver.resolveMobility(
                    ModelSpec.of("a1", "random_walk", params(Map.of("step_size", 0.0))));

            assertThat(model.advance(new Position(1.0, 2.0), 1.0)).isEqualTo(new Position(1.0, 2.0));
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInput {

        @Test
        @DisplayName("Nakagami without m_factor is rejected")
        void nakagami_missingParameter() {
            assertThatThrownBy(() -> resolver.resolveFading(
                    ModelSpec.of("c0", "nakagami", params(Map.of("omega", 1.0)))))
                    .isInstanceOf(InvalidModelParametersException.class)
                    .hasMessageContaining("m_factor");
        }

        @Test
        @DisplayName("Out-of-domain parameters are rejected")
        void outOfDomain_rejected() {
            assertThatThrownBy(() -> resolver.resolveFading(
                    ModelSpec.of("c0", "nakagami", params(Map.of("m_factor", 0.0, "omega", 1.0)))))
                    .isInstanceOf(InvalidModelParametersException.class);
            assertThatThrownBy(() -> resolver.resolveFading(
                    ModelSpec.of("c0", "rician", params(Map.of("k_factor", -1.0)))))
                    .isInstanceOf(InvalidModelParametersException.class);
            assertThatThrownBy(() -> resolver.resolveMobility(
                    ModelSpec.of("a1", "random_walk", params(Map.of("step_size", -0.1)))))
                    .isInstanceOf(InvalidModelParametersException.class);
        }

        @Test
        @DisplayName("Non-numeric parameters are rejected")
        void wrongType_rejected() {
            assertThatThrownBy(() -> resolver.resolveFading(
                    ModelSpec.of("c0", "rayleigh", params(Map.of("sigma", "wide")))))
                    .isInstanceOf(InvalidModelParametersException.class);
        }

        @Test
        @DisplayName("A mobility alias cannot be used for fading and vice versa")
        void wrongKindAlias_rejected() {
            assertThatThrownBy(() -> resolver.resolveFading(ModelSpec.of("c0", "random_walk", ConfigFactory.empty())))
                    .isInstanceOf(ModelResolutionException.class)
                    .isNotInstanceOf(InvalidModelParametersException.class)
                    .hasMessageContaining("not a fading model");
            assertThatThrownBy(() -> resolver.resolveMobility(ModelSpec.of("a1", "rician", ConfigFactory.empty())))
                    .isInstanceOf(ModelResolutionException.class)
                    .hasMessageContaining("not a mobility model");
        }

        @Test
        @DisplayName("Unknown aliases are rejected")
        void unknownAlias_rejected() {
            assertThatThrownBy(() -> resolver.resolveFading(ModelSpec.of("c0", "shadowing", ConfigFactory.empty())))
                    .isInstanceOf(ModelResolutionException.class)
                    .hasMessageContaining("shadowing");
        }

        @Test
        @DisplayName("A class of the wrong capability is rejected")
        void wrongCapabilityClass_rejected() {
            assertThatThrownBy(() -> resolver.resolveFading(
                    ModelSpec.of("c0", ScriptedSimulator.class.getName(), ConfigFactory.empty())))
                    .isInstanceOf(ModelResolutionException.class);
        }
    }

    @Nested
    @DisplayName("Qualified references")
    class QualifiedReferences {

        @Test
        @DisplayName("Custom fading classes are constructed with their parameters")
        void customClass_isBuilt() {
            IFadingModel model = resolver.resolveFading(
                    ModelSpec.of("c0", ConstantFadingModel.class.getName(), params(Map.of("gain", -3.0))));

            assertThat(model).isInstanceOf(ConstantFadingModel.class);
            assertThat(model.sample(LINK)).isEqualTo(-3.0);
        }
    }

    @Test
    @DisplayName("Resolving the same spec twice yields the same sample sequence")
    void resolution_isIdempotent() {
        ModelSpec spec = ModelSpec.of("c0", "rician", params(Map.of("k_factor", 3.0, "sigma", 1.0)));
        IFadingModel first = resolver.resolveFading(spec);
        IFadingModel second = resolver.resolveFading(spec);

        assertThat(first).isNotSameAs(second).hasSameClassAs(second);
        for (int i = 0; i < 10; i++) {
            assertThat(first.sample(LINK)).isEqualTo(second.sample(LINK));
        }
    }

    @Test
    @DisplayName("Overrides for the same target: last one wins")
    void overrides_lastWins() {
        Map<String, IFadingModel> models = resolver.resolveFadingOverrides(List.of(
                ModelSpec.of("c0", "rician", ConfigFactory.empty()),
                ModelSpec.of("c1", "rayleigh", ConfigFactory.empty()),
                ModelSpec.of("c0", "nakagami", params(Map.of("m_factor", 1.0, "omega", 1.0)))));

        assertThat(models).containsOnlyKeys("c0", "c1");
        assertThat(models.keySet()).containsExactly("c0", "c1");
        assertThat(models.get("c0")).isInstanceOf(NakagamiFadingModel.class);
    }
}

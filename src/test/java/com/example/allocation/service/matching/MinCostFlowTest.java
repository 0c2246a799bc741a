package com.example.allocation.service.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MinCostFlowTest {

    @Nested
    @DisplayName("Profit maximization")
    class ProfitMaximization {

        @Test
        @DisplayName("should route flow through the cheapest paths within capacities")
        void cheapestPaths() {
            // 0 -> {1, 2} -> 3, node 1 is cheaper but carries only one unit
            MinCostFlow network = new MinCostFlow(4);
            network.addEdge(0, 1, 1, -5);
            network.addEdge(0, 2, 2, -3);
            int viaOne = network.addEdge(1, 3, 2, 0);
            int viaTwo = network.addEdge(2, 3, 2, 0);

            long cost = network.minimizeCost(0, 3);

            assertThat(cost).isEqualTo(-11);
            assertThat(network.flow(viaOne)).isEqualTo(1);
            assertThat(network.flow(viaTwo)).isEqualTo(2);
        }

        @Test
        @DisplayName("should stop before a path that would lower the profit")
        void stopsAtNonNegativePath() {
            MinCostFlow network = new MinCostFlow(3);
            int profitable = network.addEdge(0, 1, 1, -4);
            int costly = network.addEdge(0, 1, 1, 2);
            network.addEdge(1, 2, 2, 0);

            assertThat(network.minimizeCost(0, 2)).isEqualTo(-4);
            assertThat(network.flow(profitable)).isEqualTo(1);
            assertThat(network.flow(costly)).isZero();
        }

        @Test
        @DisplayName("should reroute earlier flow when a later path needs its edge")
        void reroutesThroughResidualEdges() {
            // a: 0->1, b: 0->2; seats x (3) and y (4) each take one unit.
            // a prefers x (-10) over y (-9); b only fits x (-8). Best is a->y, b->x = -17.
            MinCostFlow network = new MinCostFlow(6);
            network.addEdge(0, 1, 1, 0);
            network.addEdge(0, 2, 1, 0);
            int ax = network.addEdge(1, 3, 1, -10);
            int ay = network.addEdge(1, 4, 1, -9);
            int bx = network.addEdge(2, 3, 1, -8);
            network.addEdge(3, 5, 1, 0);
            network.addEdge(4, 5, 1, 0);

            assertThat(network.minimizeCost(0, 5)).isEqualTo(-17);
            assertThat(network.flow(ax)).isZero();
            assertThat(network.flow(ay)).isEqualTo(1);
            assertThat(network.flow(bx)).isEqualTo(1);
        }

        @Test
        @DisplayName("should push nothing when the sink is unreachable")
        void unreachableSink() {
            MinCostFlow network = new MinCostFlow(3);
            int edge = network.addEdge(0, 1, 1, -1);

            assertThat(network.minimizeCost(0, 2)).isZero();
            assertThat(network.flow(edge)).isZero();
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInput {

        @Test
        @DisplayName("should reject a negative capacity")
        void negativeCapacity() {
            MinCostFlow network = new MinCostFlow(2);

            assertThatThrownBy(() -> network.addEdge(0, 1, -1, 0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("0->1");
        }

        @Test
        @DisplayName("should report cost overflow as an arithmetic error")
        void overflow() {
            MinCostFlow network = new MinCostFlow(3);
            network.addEdge(0, 1, 1, Long.MIN_VALUE + 1);
            network.addEdge(1, 2, 1, -2);

            assertThatThrownBy(() -> network.minimizeCost(0, 2)).isInstanceOf(ArithmeticException.class);
        }
    }
}

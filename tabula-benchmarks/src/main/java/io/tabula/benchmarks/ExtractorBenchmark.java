package io.tabula.benchmarks;

import io.tabula.core.Cell;
import io.tabula.core.TabulaConfiguration;
import io.tabula.core.TabulaConfiguration.AccessStrategy;
import io.tabula.dump.CsvDumper;
import io.tabula.extract.Column;
import io.tabula.extract.Extractor;
import io.tabula.format.Format;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Row read throughput of the two access strategies over a three-hop path with an optional.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 1, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ExtractorBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({"FUSED", "STEPWISE"})
        public AccessStrategy strategy;

        @Param({"10000"})
        public int rows;

        private Extractor<Order> extractor;
        private Column city;
        private int row;

        @Setup(Level.Trial)
        public void setup() {
            List<Order> orders = new ArrayList<>(rows);
            for (int i = 0; i < rows; i++) {
                Address address = i % 10 == 0 ? null : new Address("City-" + (i % 100));
                orders.add(new Order(i, i * 1.25, Instant.ofEpochSecond(i), new Customer("customer-" + i, address)));
            }
            TabulaConfiguration configuration = TabulaConfiguration.builder().accessStrategy(strategy).build();
            extractor = Extractor.create(Order.class, orders, configuration,
                    "id", "total", "placed", "customer.name", "customer.address.city");
            city = extractor.column("customer.address.city").orElseThrow();
        }
    }

    @Benchmark
    public Cell nested_valueAt(BenchmarkState state) {
        int row = state.row++;
        if (state.row == state.rows) {
            state.row = 0;
        }
        return state.city.valueAt(row);
    }

    @Benchmark
    public void full_scan(BenchmarkState state, Blackhole blackhole) {
        Extractor<Order> extractor = state.extractor;
        for (Column column : extractor.columns()) {
            for (int row = 0; row < extractor.rowCount(); row++) {
                blackhole.consume(column.valueAt(row));
            }
        }
    }

    @Benchmark
    public int csv_dump(BenchmarkState state) throws IOException {
        StringBuilder out = new StringBuilder(state.rows * 64);
        new CsvDumper(out).dump(state.extractor, Format.PRECISE);
        return out.length();
    }

    public static class Order {
        private final long id;
        private final double total;
        private final Instant placed;
        private final Customer customer;

        Order(long id, double total, Instant placed, Customer customer) {
            this.id = id;
            this.total = total;
            this.placed = placed;
            this.customer = customer;
        }
    }

    public static class Customer {
        private final String name;
        private final Address home;

        Customer(String name, Address home) {
            this.name = name;
            this.home = home;
        }

        public Optional<Address> address() {
            return Optional.ofNullable(home);
        }
    }

    public static class Address {
        private final String city;

        Address(String city) {
            this.city = city;
        }
    }
}

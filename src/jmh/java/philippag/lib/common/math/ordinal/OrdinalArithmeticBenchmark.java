package philippag.lib.common.math.ordinal;

import java.util.concurrent.TimeUnit;
import java.util.function.BinaryOperator;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)
@Measurement(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Threads(1)
@Fork(1)
@State(Scope.Benchmark)
public class OrdinalArithmeticBenchmark {

    private static class Args {

        private static final String[] STRING = {
                "w^2*5+w*7+9", "w^3+w+1",
                "w^w^w+w^(w+1)*3+w^5", "w^(w*2)+w^w*9+12345",
                "(w+1)^20", "w^(w^2+w)*4+w^w",
                "w^^6+w^^5*2+w^^4", "w^^6+w^^3",
        };

        private static final CnfOrdinal[] CNF = parse(STRING);
    }

    @Param({"false", "true"})
    public boolean reversed;

    @Benchmark
    public void add(Blackhole blackhole) {
        perform(Args.CNF, (l, r) -> OrdinalArithmetic.add(l, r, OperationBudget.unlimited()), blackhole);
    }

    @Benchmark
    public void multiply(Blackhole blackhole) {
        perform(Args.CNF, (l, r) -> OrdinalArithmetic.multiply(l, r, OperationBudget.unlimited()), blackhole);
    }

    @Benchmark
    public void compare(Blackhole blackhole) {
        for (int j = 0; j < Args.CNF.length;) {
            var lhs = Args.CNF[j++];
            var rhs = Args.CNF[j++];
            blackhole.consume(OrdinalComparison.compareCnf(lhs, rhs, OperationBudget.unlimited()));
        }
    }

    @Benchmark
    public void parse(Blackhole blackhole) {
        for (var str : Args.STRING) {
            blackhole.consume(OrdinalParser.evaluate(str, new OperationBudget()));
        }
    }

    @Benchmark
    public void embedding(Blackhole blackhole) {
        var embedding = new OrdinalEmbedding();
        for (var alpha : Args.CNF) {
            double x = embedding.value(alpha);
            blackhole.consume(embedding.fInverse(x));
        }
    }

    private void perform(CnfOrdinal[] args, BinaryOperator<CnfOrdinal> operator, Blackhole blackhole) {
        for (int j = 0; j < args.length;) {
            var lhs = args[j++];
            var rhs = args[j++];
            var result = reversed ? operator.apply(rhs, lhs) : operator.apply(lhs, rhs);
            blackhole.consume(result);
        }
    }

    private static CnfOrdinal[] parse(String[] args) {
        var result = new CnfOrdinal[args.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = (CnfOrdinal) OrdinalParser.evaluate(args[i], new OperationBudget());
        }
        return result;
    }
}

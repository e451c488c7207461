import java.util.function.IntUnaryOperator;

public class Unsupported {

    static int apply(int x) {
        IntUnaryOperator twice = v -> v * 2;
        return twice.applyAsInt(x);
    }

    static int square(int x) {
        return x * x;
    }

    static int square(long x) {
        return (int) (x * x);
    }

    interface Shape {
        double area();
    }
}

interface Named {
    String name();
}

package io.github.reugn.stringly4j.fixture;

public class Inner {
    public double x;
    public long y;
    public KeyValue keyValuePair;

    public Inner() {
        this(0.0, 0, new KeyValue());
    }

    public Inner(double x, long y, KeyValue keyValuePair) {
        this.x = x;
        this.y = y;
        this.keyValuePair = keyValuePair;
    }
}

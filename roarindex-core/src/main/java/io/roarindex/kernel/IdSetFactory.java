package io.roarindex.kernel;

public record IdSetFactory(boolean runOptimizeOnAdd) {

    public static IdSetFactory defaultFactory() {
        return new IdSetFactory(false);
    }

    public MutableIdSet create() {
        return new RoaringIdSet(runOptimizeOnAdd);
    }
}

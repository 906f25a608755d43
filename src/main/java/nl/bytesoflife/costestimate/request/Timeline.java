package nl.bytesoflife.costestimate.request;

import java.util.stream.IntStream;

/**
 * The years an asset is built, operated and decommissioned. All ranges are inclusive.
 * Ranges are used as given: they are not checked for order or overlap, and an inverted range
 * simply contains no years.
 */
public record Timeline(
        int constructionStart,
        int constructionFinish,
        int operationStart,
        int operationFinish,
        int decommissioningStart,
        int decommissioningFinish
) {

    /**
     * First year of the asset's life, the reference year for discounting.
     */
    public int start() {
        return constructionStart;
    }

    public int end() {
        return decommissioningFinish;
    }

    /**
     * Every year from construction start to decommissioning finish.
     */
    public IntStream years() {
        return IntStream.rangeClosed(start(), end());
    }

    public boolean isConstructionYear(int year) {
        return year >= constructionStart && year <= constructionFinish;
    }

    public boolean isOperationYear(int year) {
        return year >= operationStart && year <= operationFinish;
    }

    public boolean isDecommissioningYear(int year) {
        return year >= decommissioningStart && year <= decommissioningFinish;
    }

    public int constructionYearCount() {
        return yearCount(constructionStart, constructionFinish);
    }

    public int operationYearCount() {
        return yearCount(operationStart, operationFinish);
    }

    public int decommissioningYearCount() {
        return yearCount(decommissioningStart, decommissioningFinish);
    }

    private static int yearCount(int start, int finish) {
        return Math.max(0, finish - start + 1);
    }
}

package nl.bytesoflife.costestimate.estimate;

/**
 * The utilities and consumables a cost item can draw on while operating.
 * The library name is both the contribution name in the cost library and the parameter name
 * the caller supplies the consumption under.
 */
public enum VariableOpexCategory {
    ELECTRICAL_POWER("Electrical power", 0.4),
    COOLING_WATER("Cooling water (10degC temp rise)", 0.4),
    NATURAL_GAS("Natural gas", 0.4),
    STEAM_HP_SUPERHEATED("Steam HP superheat, 600degC and 50bara", 0.4),
    STEAM_LP_SATURATED("Steam LP saturated, 160degC and 6.2bara", 0.4),
    CATALYSTS_AND_CHEMICALS("Catalysts and chemicals", 0.4),
    EQUIPMENT_ITEM_RENTAL("Equipment item rental", 0.4),
    COST_PER_TONNE_OF_CO2("Cost per tonne of CO2", 0.4),
    TARIFF("Tariff paid to storage reservoir owner", 20.0);

    /** 95% operational uptime. */
    public static final double OPERATIONAL_HOURS_PER_YEAR = 24.0 * 365.0 * 0.95;

    private final String libraryName;
    private final double hourlyRate;

    VariableOpexCategory(String libraryName, double hourlyRate) {
        this.libraryName = libraryName;
        this.hourlyRate = hourlyRate;
    }

    public String getLibraryName() {
        return libraryName;
    }

    /**
     * Cost of one unit of consumption over a year of operation.
     */
    public double getUnitCost() {
        return hourlyRate * OPERATIONAL_HOURS_PER_YEAR;
    }

    public static VariableOpexCategory fromLibraryName(String name) {
        for (VariableOpexCategory category : values()) {
            if (category.libraryName.equals(name)) {
                return category;
            }
        }
        return null;
    }
}

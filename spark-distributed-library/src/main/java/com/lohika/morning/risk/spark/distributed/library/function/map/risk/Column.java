package com.lohika.morning.risk.spark.distributed.library.function.map.risk;

import java.util.Arrays;
import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;

/**
 * Fixed schema of the client risk dataset. Every raw file, the merged dataset and
 * the held-out test set carry these columns.
 */
public enum Column {

    CORPORATION("corporation", Role.IDENTIFIER),
    LAST_MONTH_ACTIVITY("lastmonth_activity", Role.FEATURE),
    LAST_YEAR_ACTIVITY("lastyear_activity", Role.FEATURE),
    NUMBER_OF_EMPLOYEES("number_of_employees", Role.FEATURE),
    EXITED("exited", Role.LABEL),

    // Columns produced by the model pipeline, never read from files.
    FEATURES("features", Role.DERIVED),
    PREDICTION("prediction", Role.DERIVED),
    PROBABILITY("probability", Role.DERIVED),
    RAW_PREDICTION("rawPrediction", Role.DERIVED);

    public enum Role {
        IDENTIFIER, FEATURE, LABEL, DERIVED
    }

    private final String name;
    private final Role role;

    Column(String name, Role role) {
        this.name = name;
        this.role = role;
    }

    public String getName() {
        return name;
    }

    public Role getRole() {
        return role;
    }

    public DataType getDataType() {
        switch (role) {
            case IDENTIFIER:
                return DataTypes.StringType;
            case LABEL:
                return DataTypes.IntegerType;
            default:
                return DataTypes.DoubleType;
        }
    }

    /** Columns every source file must provide, in canonical order. */
    public static Column[] dataColumns() {
        return Arrays.stream(values())
                .filter(column -> column.role != Role.DERIVED)
                .toArray(Column[]::new);
    }

    public static String[] dataColumnNames() {
        return Arrays.stream(dataColumns()).map(Column::getName).toArray(String[]::new);
    }

    public static String[] featureColumnNames() {
        return Arrays.stream(values())
                .filter(column -> column.role == Role.FEATURE)
                .map(Column::getName)
                .toArray(String[]::new);
    }

    /** Identifier, label and features: everything a CSV header may legitimately name. */
    public static Column fromName(String name) {
        return Arrays.stream(dataColumns())
                .filter(column -> column.name.equals(name))
                .findFirst()
                .orElse(null);
    }
}

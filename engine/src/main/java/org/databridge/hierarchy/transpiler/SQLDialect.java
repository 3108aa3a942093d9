package org.databridge.hierarchy.transpiler;

import org.databridge.hierarchy.plan.AggregateExpression;
import org.databridge.hierarchy.plan.QualifiedName;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Capability set of one target database: identifier quoting, literal formats, the exact
 * decimal type, view DDL, object-name casing and materialization syntax.
 *
 * <p>Dialects are plain values passed into the generator; there is one constant per
 * supported database and no per-dialect subclass.
 *
 * @param name            Display name, e.g. "Snowflake"
 * @param openQuote       Opening identifier quote
 * @param closeQuote      Closing identifier quote
 * @param trueLiteral     Rendering of boolean true
 * @param falseLiteral    Rendering of boolean false
 * @param decimalType     Exact numeric type used to avoid integer division
 * @param viewPrefix      Statement prefix that creates or replaces a view
 * @param upperCaseNames  Whether generated object names are upper-cased (else lower-cased)
 * @param materialization Dynamic/materialized table syntax
 */
public record SQLDialect(
        String name,
        String openQuote,
        String closeQuote,
        String trueLiteral,
        String falseLiteral,
        String decimalType,
        String viewPrefix,
        boolean upperCaseNames,
        Materialization materialization) {

    private static final Pattern SIMPLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static final SQLDialect SNOWFLAKE = new SQLDialect(
            "Snowflake", "\"", "\"", "TRUE", "FALSE", "NUMBER(38, 10)", "CREATE OR REPLACE VIEW", true,
            new Materialization(
                    Materialization.Style.DYNAMIC_TABLE,
                    List.of(),
                    "CREATE OR REPLACE DYNAMIC TABLE {name}\n"
                            + "    TARGET_LAG = '{lag}'\n"
                            + "    REFRESH_MODE = AUTO\n"
                            + "    INITIALIZE = ON_CREATE\n"
                            + "    WAREHOUSE = {warehouse}\n"
                            + "AS",
                    ";",
                    List.of(
                            "Manual refresh: ALTER DYNAMIC TABLE {name} REFRESH;",
                            "Suspend: ALTER DYNAMIC TABLE {name} SUSPEND;",
                            "Refresh history: SELECT * FROM TABLE(INFORMATION_SCHEMA.DYNAMIC_TABLE_REFRESH_HISTORY(NAME => '{name}'));")));

    public static final SQLDialect POSTGRES = new SQLDialect(
            "Postgres", "\"", "\"", "TRUE", "FALSE", "NUMERIC(38, 10)", "CREATE OR REPLACE VIEW", false,
            new Materialization(
                    Materialization.Style.MATERIALIZED_VIEW,
                    List.of("DROP MATERIALIZED VIEW IF EXISTS {name};"),
                    "CREATE MATERIALIZED VIEW {name} AS",
                    "\nWITH DATA;",
                    List.of(
                            "Refresh: REFRESH MATERIALIZED VIEW {name};",
                            "Schedule the refresh externally, e.g. with pg_cron, to approximate a target lag of {lag}.")));

    public static final SQLDialect MYSQL = new SQLDialect(
            "MySQL", "`", "`", "TRUE", "FALSE", "DECIMAL(38, 10)", "CREATE OR REPLACE VIEW", false,
            Materialization.NONE);

    public static final SQLDialect SQL_SERVER = new SQLDialect(
            "SQLServer", "[", "]", "1", "0", "DECIMAL(38, 10)", "CREATE OR ALTER VIEW", true,
            new Materialization(
                    Materialization.Style.SCHEMA_BOUND_VIEW,
                    List.of(),
                    "CREATE OR ALTER VIEW {name}\nWITH SCHEMABINDING\nAS",
                    ";",
                    List.of(
                            "Schema binding requires two-part names (schema.table) for every referenced table.",
                            "Persist with a unique clustered index: CREATE UNIQUE CLUSTERED INDEX IX_VALUES ON {name} (...);")));

    private static final List<SQLDialect> ALL = List.of(SNOWFLAKE, POSTGRES, MYSQL, SQL_SERVER);

    public SQLDialect {
        Objects.requireNonNull(name, "Dialect name cannot be null");
        Objects.requireNonNull(materialization, "Materialization cannot be null");
    }

    /**
     * @return Every supported dialect, in a fixed order
     */
    public static List<SQLDialect> all() {
        return ALL;
    }

    /**
     * Looks a dialect up by name, case-insensitively. Accepts the common aliases
     * postgresql, mssql and sql_server.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static SQLDialect fromName(String dialectName) {
        String key = dialectName == null ? "" : dialectName.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "snowflake" -> SNOWFLAKE;
            case "postgres", "postgresql" -> POSTGRES;
            case "mysql" -> MYSQL;
            case "sqlserver", "sql_server", "mssql" -> SQL_SERVER;
            default -> throw new IllegalArgumentException("Unknown dialect: " + dialectName);
        };
    }

    /**
     * Quote an identifier (column name, alias), escaping embedded closing quotes.
     */
    public String quoteIdentifier(String identifier) {
        return openQuote + identifier.replace(closeQuote, closeQuote + closeQuote) + closeQuote;
    }

    /**
     * Quote a string literal value.
     */
    public String quoteStringLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    public String formatBoolean(boolean value) {
        return value ? trueLiteral : falseLiteral;
    }

    public String formatNull() {
        return "NULL";
    }

    public String aggregateName(AggregateExpression.AggregateFunction function) {
        return function.sql();
    }

    /**
     * Applies the dialect's object-name casing, then quotes the name only when it is not a
     * plain identifier.
     */
    public String formatObjectName(String objectName) {
        String cased = upperCaseNames
                ? objectName.toUpperCase(Locale.ROOT)
                : objectName.toLowerCase(Locale.ROOT);
        return formatNamePart(cased);
    }

    /**
     * Renders a user-supplied qualified name as written, quoting only parts that are not
     * plain identifiers.
     */
    public String formatQualifiedName(QualifiedName qualifiedName) {
        StringBuilder sb = new StringBuilder();
        for (String part : qualifiedName.parts()) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(formatNamePart(part));
        }
        return sb.toString();
    }

    public boolean supportsMaterialization() {
        return materialization.isSupported();
    }

    private String formatNamePart(String part) {
        return SIMPLE_NAME.matcher(part).matches() ? part : quoteIdentifier(part);
    }

    @Override
    public String toString() {
        return name;
    }
}

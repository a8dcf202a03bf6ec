package com.ifip.fundamentals.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Logical financial metrics and the XBRL tag aliases that may carry them, highest priority first.
 */
public enum LogicalMetric {
    REVENUE("Revenue", PeriodType.DURATION, "USD", true, List.of(
        "Revenues",
        "RevenueFromContractWithCustomerExcludingAssessedTax",
        "SalesRevenueNet",
        "RevenueFromContractWithCustomerIncludingAssessedTax",
        "SalesRevenueGoodsNet",
        "Revenue"
    )),
    COST_OF_REVENUE("CostOfRevenue", PeriodType.DURATION, "USD", false, List.of(
        "CostOfRevenue",
        "CostOfGoodsAndServicesSold",
        "CostOfGoodsSold",
        "CostOfSales"
    )),
    GROSS_PROFIT("GrossProfit", PeriodType.DURATION, "USD", false, List.of(
        "GrossProfit"
    )),
    OPERATING_INCOME("OperatingIncome", PeriodType.DURATION, "USD", false, List.of(
        "OperatingIncomeLoss",
        "ProfitLossFromOperatingActivities"
    )),
    NET_INCOME("NetIncome", PeriodType.DURATION, "USD", true, List.of(
        "NetIncomeLoss",
        "NetIncomeLossAvailableToCommonStockholdersBasic",
        "ProfitLoss"
    )),
    EPS_DILUTED("EpsDiluted", PeriodType.DURATION, "USD/shares", false, List.of(
        "EarningsPerShareDiluted",
        "EarningsPerShareBasic"
    )),
    OPERATING_CASH_FLOW("OperatingCashFlow", PeriodType.DURATION, "USD", false, List.of(
        "NetCashProvidedByUsedInOperatingActivities",
        "NetCashProvidedByOperatingActivities"
    )),
    CAPITAL_EXPENDITURES("CapitalExpenditures", PeriodType.DURATION, "USD", false, List.of(
        "PaymentsToAcquirePropertyPlantAndEquipment",
        "CapitalExpenditures"
    )),
    TOTAL_ASSETS("TotalAssets", PeriodType.INSTANT, "USD", true, List.of(
        "Assets"
    )),
    TOTAL_LIABILITIES("TotalLiabilities", PeriodType.INSTANT, "USD", true, List.of(
        "Liabilities"
    )),
    STOCKHOLDERS_EQUITY("StockholdersEquity", PeriodType.INSTANT, "USD", true, List.of(
        "StockholdersEquity",
        "StockholdersEquityIncludingPortionAttributableToNoncontrollingInterest"
    )),
    CASH("Cash", PeriodType.INSTANT, "USD", false, List.of(
        "CashAndCashEquivalentsAtCarryingValue",
        "Cash"
    ));

    private final String metricName;
    private final PeriodType periodType;
    private final String unit;
    private final boolean core;
    private final List<String> aliases;

    LogicalMetric(String metricName, PeriodType periodType, String unit, boolean core, List<String> aliases) {
        this.metricName = metricName;
        this.periodType = periodType;
        this.unit = unit;
        this.core = core;
        this.aliases = aliases;
    }

    public static List<LogicalMetric> coreMetrics() {
        return Arrays.stream(values()).filter(LogicalMetric::isCore).toList();
    }

    public String metricName() {
        return metricName;
    }

    public PeriodType periodType() {
        return periodType;
    }

    public boolean isInstant() {
        return periodType == PeriodType.INSTANT;
    }

    /**
     * Facts reported in any other unit are ignored for this metric.
     */
    public boolean acceptsUnit(String reportedUnit) {
        return reportedUnit != null && reportedUnit.equalsIgnoreCase(unit);
    }

    public boolean isCore() {
        return core;
    }

    public List<String> aliases() {
        return aliases;
    }
}

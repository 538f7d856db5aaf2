package io.daylit.roi.util;

public class ConstantUtility {

	public static final String PRODUCT_NAME = "Daylit X";

	public static final String TIER_SMALL = "Small";

	public static final String TIER_MIDDLE_MARKET = "Middle market";

	public static final String TIER_ENTERPRISE = "Enterprise";

	public static final String RETAIL_DISTRIBUTORS = "Retail Distributors";

	public static final String CHEMICAL_SPECIALTY = "Chemical (Specialty)";

	public static final String HOSPITALS_HEALTHCARE = "Hospitals/Healthcare Facilities";

	public static final String BUSINESS_CONSUMER_SERVICES = "Business & Consumer Services";

	public static final double DAYS_PER_YEAR = 365.0;

	public static final double DEFAULT_COST_OF_CAPITAL_ANNUAL_PCT = 0.045;

	public static final double DEFAULT_DSO_REDUCTION_RELATIVE_PCT = 0.40;

	public static final double DEFAULT_BAD_DEBT_REDUCTION_RELATIVE_PCT = 0.40;

	public static final double DEFAULT_PRODUCTIVITY_TIME_SAVED_PCT = 0.50;

	public static final int DEFAULT_HOURS_PER_FTE_PER_YEAR = 2000;

	public static final int DEFAULT_WORKING_DAYS_PER_YEAR = 365;

	public static final double DEFAULT_PERCENTAGE_OF_TIME_ON_INVOICES = 0.80;

	private ConstantUtility() {
	}
}

package io.daylit.roi.config;

import static io.daylit.roi.util.ConstantUtility.*;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import io.daylit.roi.vo.RoiAssumptions;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
@Validated
@ConfigurationProperties(prefix = "roi.assumptions")
public class RoiAssumptionsProperties {

	@PositiveOrZero
	private double costOfCapitalAnnualPct = DEFAULT_COST_OF_CAPITAL_ANNUAL_PCT;

	@PositiveOrZero
	private double dsoReductionRelativePct = DEFAULT_DSO_REDUCTION_RELATIVE_PCT;

	@PositiveOrZero
	private double badDebtReductionRelativePct = DEFAULT_BAD_DEBT_REDUCTION_RELATIVE_PCT;

	@PositiveOrZero
	private double productivityTimeSavedPct = DEFAULT_PRODUCTIVITY_TIME_SAVED_PCT;

	@Positive
	private int hoursPerFtePerYear = DEFAULT_HOURS_PER_FTE_PER_YEAR;

	@Positive
	private int workingDaysPerYear = DEFAULT_WORKING_DAYS_PER_YEAR;

	@PositiveOrZero
	private double percentageOfTimeOnInvoices = DEFAULT_PERCENTAGE_OF_TIME_ON_INVOICES;

	public RoiAssumptions toAssumptions() {
		return RoiAssumptions.builder()
			.costOfCapitalAnnualPct(costOfCapitalAnnualPct)
			.dsoReductionRelativePct(dsoReductionRelativePct)
			.badDebtReductionRelativePct(badDebtReductionRelativePct)
			.productivityTimeSavedPct(productivityTimeSavedPct)
			.hoursPerFtePerYear(hoursPerFtePerYear)
			.workingDaysPerYear(workingDaysPerYear)
			.percentageOfTimeOnInvoices(percentageOfTimeOnInvoices)
			.build();
	}
}

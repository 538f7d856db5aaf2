package io.daylit.roi.vo;

import static io.daylit.roi.util.ConstantUtility.*;

import io.daylit.roi.exception.NotValidException;
import io.daylit.roi.exception.RoiExceptionMessage;
import lombok.Builder;
import lombok.Value;

/**
 * Model assumptions applied to every calculation. All fields default to the standard
 * product impact figures and may be overridden through the builder.
 * <p>
 * {@code hoursPerFtePerYear} and {@code workingDaysPerYear} are divisors and must be
 * strictly positive; construction fails with {@link NotValidException} otherwise.
 */
@Value
public class RoiAssumptions {

	double costOfCapitalAnnualPct;
	double dsoReductionRelativePct;
	double badDebtReductionRelativePct;
	double productivityTimeSavedPct;
	int hoursPerFtePerYear;
	int workingDaysPerYear;
	double percentageOfTimeOnInvoices;

	@Builder(toBuilder = true)
	public RoiAssumptions(double costOfCapitalAnnualPct, double dsoReductionRelativePct,
		double badDebtReductionRelativePct, double productivityTimeSavedPct, int hoursPerFtePerYear,
		int workingDaysPerYear, double percentageOfTimeOnInvoices) {
		if (hoursPerFtePerYear <= 0) {
			throw new NotValidException(RoiExceptionMessage.INVALID_HOURS_PER_FTE, hoursPerFtePerYear);
		}
		if (workingDaysPerYear <= 0) {
			throw new NotValidException(RoiExceptionMessage.INVALID_WORKING_DAYS, workingDaysPerYear);
		}
		this.costOfCapitalAnnualPct = costOfCapitalAnnualPct;
		this.dsoReductionRelativePct = dsoReductionRelativePct;
		this.badDebtReductionRelativePct = badDebtReductionRelativePct;
		this.productivityTimeSavedPct = productivityTimeSavedPct;
		this.hoursPerFtePerYear = hoursPerFtePerYear;
		this.workingDaysPerYear = workingDaysPerYear;
		this.percentageOfTimeOnInvoices = percentageOfTimeOnInvoices;
	}

	public static RoiAssumptions defaults() {
		return builder().build();
	}

	public static class RoiAssumptionsBuilder {
		private double costOfCapitalAnnualPct = DEFAULT_COST_OF_CAPITAL_ANNUAL_PCT;
		private double dsoReductionRelativePct = DEFAULT_DSO_REDUCTION_RELATIVE_PCT;
		private double badDebtReductionRelativePct = DEFAULT_BAD_DEBT_REDUCTION_RELATIVE_PCT;
		private double productivityTimeSavedPct = DEFAULT_PRODUCTIVITY_TIME_SAVED_PCT;
		private int hoursPerFtePerYear = DEFAULT_HOURS_PER_FTE_PER_YEAR;
		private int workingDaysPerYear = DEFAULT_WORKING_DAYS_PER_YEAR;
		private double percentageOfTimeOnInvoices = DEFAULT_PERCENTAGE_OF_TIME_ON_INVOICES;
	}
}

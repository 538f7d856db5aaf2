package io.daylit.roi.helper;

import org.springframework.stereotype.Component;

import io.daylit.roi.vo.RoiAssumptions;
import io.daylit.roi.vo.RoiInputs;

/**
 * Benefit formulas. Every metric is floored at zero.
 */
@Component
public class BenefitCalculationHelper {

	/**
	 * Working capital freed by collecting receivables faster. No cost-of-capital
	 * multiplier is applied and the value is not part of the ROI benefit.
	 */
	public double computeCashFlowImprovement(RoiInputs inputs, RoiAssumptions assumptions) {
		double daysReduced = inputs.getCurrentDsoDays() * assumptions.getDsoReductionRelativePct();
		double averageDailyRevenue = inputs.getAnnualRevenue() / assumptions.getWorkingDaysPerYear();
		return Math.max(0.0, averageDailyRevenue * daysReduced);
	}

	/** Labor cost saved by the A/R team spending less time on invoices. */
	public double computeAnnualizedEmployeeSavings(RoiInputs inputs, RoiAssumptions assumptions) {
		double hourlyWage = inputs.getFteSalaryBase() / assumptions.getHoursPerFtePerYear();
		double timeSpentOnInvoices = assumptions.getHoursPerFtePerYear() * assumptions.getPercentageOfTimeOnInvoices();
		double savings = inputs.getArHeadcount() * timeSpentOnInvoices * assumptions.getProductivityTimeSavedPct()
			* hourlyWage;
		return Math.max(0.0, savings);
	}

	public double computeProductivityHoursSaved(RoiInputs inputs, RoiAssumptions assumptions) {
		double totalHours = (double) inputs.getArHeadcount() * assumptions.getHoursPerFtePerYear()
			* assumptions.getProductivityTimeSavedPct() * assumptions.getPercentageOfTimeOnInvoices();
		return Math.max(0.0, totalHours);
	}

	/**
	 * Relative reduction of baseline bad debt, where the baseline is a share of the A/R
	 * balance implied by current DSO: {@code revenue x (dso / working days)}.
	 */
	public double computeBadDebtSavings(RoiInputs inputs, RoiAssumptions assumptions) {
		double estimatedArBalance = inputs.getAnnualRevenue()
			* (inputs.getCurrentDsoDays() / assumptions.getWorkingDaysPerYear());
		double baselineBadDebt = estimatedArBalance * inputs.getBadDebtPct();
		return Math.max(0.0, baselineBadDebt * assumptions.getBadDebtReductionRelativePct());
	}

	/**
	 * ((benefit - cost) / cost) * 100. A non-positive cost gives +inf for a positive
	 * benefit and 0 otherwise.
	 */
	public double computeRoiPct(double totalBenefitUsd, double annualPriceUsd) {
		if (annualPriceUsd <= 0) {
			return totalBenefitUsd > 0 ? Double.POSITIVE_INFINITY : 0.0;
		}
		double roiRatio = (totalBenefitUsd - annualPriceUsd) / annualPriceUsd;
		return roiRatio * 100.0;
	}
}

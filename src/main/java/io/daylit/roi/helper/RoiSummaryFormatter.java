package io.daylit.roi.helper;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import io.daylit.roi.util.ConstantUtility;
import io.daylit.roi.vo.DsoComparison;
import io.daylit.roi.vo.IndustryBenchmark;
import io.daylit.roi.vo.RoiResults;

/**
 * Plain text rendering of a calculation for the console. Amounts are USD with no
 * decimals, formatted for {@link Locale#US}.
 */
@Component
public class RoiSummaryFormatter {

	private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

	public List<String> formatIndustries(List<IndustryBenchmark> benchmarks) {
		List<String> lines = new ArrayList<>();
		lines.add("Available industries with benchmark data:");
		for (IndustryBenchmark benchmark : benchmarks) {
			lines.add(String.format("  - %s: %d days DSO", benchmark.getIndustry(), benchmark.getBenchmarkDsoDays()));
		}
		return lines;
	}

	public List<String> formatSummary(String industry, Optional<DsoComparison> comparison, RoiResults results) {
		List<String> lines = new ArrayList<>();
		String title = ConstantUtility.PRODUCT_NAME + " ROI Summary";
		lines.add(title);
		lines.add(StringUtils.repeat('-', title.length() + 1));
		lines.add("Industry: " + industry);
		comparison.map(this::formatDsoComparison).ifPresent(lines::add);
		lines.add("");
		lines.add("Tier: " + results.getTier());
		lines.add("Price (annual): " + formatCurrency(results.getAnnualPriceUsd()));
		lines.add("ROI: " + formatPercent(results.getRoiPct()));
		lines.add("Cash flow improvement (freed cash): " + formatCurrency(results.getCashFlowImprovementUsd()));
		lines.add("Employee savings (annualized): " + formatCurrency(results.getAnnualizedEmployeeSavingsUsd()));
		lines.add("Productivity hours saved (annual): " + formatNumber(results.getProductivityHoursSaved()) + " hours");
		lines.add("Bad debt savings (annual): " + formatCurrency(results.getBadDebtSavingsUsd()));
		lines.add("Opportunity cost (annual): " + formatCurrency(results.getOpportunityCostUsd()));
		return lines;
	}

	public String formatDsoComparison(DsoComparison comparison) {
		String client = "Your DSO (" + formatDays(comparison.getClientDsoDays()) + " days)";
		String benchmark = String.format("industry benchmark (%d days)", comparison.getBenchmarkDsoDays());
		switch (comparison.getPosition()) {
		case ABOVE:
			return client + " is " + formatDays(comparison.getDifferenceDays()) + " days ABOVE " + benchmark;
		case BELOW:
			return client + " is " + formatDays(Math.abs(comparison.getDifferenceDays())) + " days BELOW "
				+ benchmark;
		default:
			return client + " matches " + benchmark;
		}
	}

	/** Whole days, rounded half-even like the amounts. */
	public String formatDays(double days) {
		return new DecimalFormat("0", SYMBOLS).format(days);
	}

	public String formatCurrency(double value) {
		String sign = value < 0 ? "-" : "";
		return sign + "$" + new DecimalFormat("#,##0", SYMBOLS).format(Math.abs(value));
	}

	public String formatNumber(double value) {
		return new DecimalFormat("#,##0", SYMBOLS).format(value);
	}

	public String formatPercent(double value) {
		if (Double.isInfinite(value)) {
			return (value < 0 ? "-" : "") + "∞%";
		}
		return new DecimalFormat("#,##0.0", SYMBOLS).format(value) + "%";
	}
}

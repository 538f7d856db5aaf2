package io.daylit.roi.vo;

import io.daylit.roi.util.ConstantUtility;
import lombok.Value;

@Value
public class IndustryBenchmark {
	String industry;
	double arToSalesRatio;
	int benchmarkDsoDays;

	/** Benchmark DSO is the A/R to sales ratio over a year, rounded to whole days. */
	public static IndustryBenchmark of(String industry, double arToSalesRatio) {
		return new IndustryBenchmark(industry, arToSalesRatio,
			(int) Math.round(arToSalesRatio * ConstantUtility.DAYS_PER_YEAR));
	}
}

package io.daylit.roi.vo;

import lombok.Value;

@Value
public class DsoComparison {
	String industry;
	double clientDsoDays;
	int benchmarkDsoDays;
	double differenceDays; // client minus benchmark
	DsoPosition position;

	public static DsoComparison of(IndustryBenchmark benchmark, double clientDsoDays) {
		double difference = clientDsoDays - benchmark.getBenchmarkDsoDays();
		return new DsoComparison(benchmark.getIndustry(), clientDsoDays, benchmark.getBenchmarkDsoDays(), difference,
			DsoPosition.fromDifference(difference));
	}
}

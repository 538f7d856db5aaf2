package io.daylit.roi.service;

import java.util.List;
import java.util.Optional;

import io.daylit.roi.vo.DsoComparison;
import io.daylit.roi.vo.IndustryBenchmark;
import io.daylit.roi.vo.PricingTier;
import io.daylit.roi.vo.RoiAssumptions;
import io.daylit.roi.vo.RoiInputs;
import io.daylit.roi.vo.RoiResults;

public interface RoiCalculationService {
	PricingTier resolveTier(double annualRevenue);

	Optional<Integer> lookupIndustryBenchmark(String industry);

	Optional<IndustryBenchmark> findIndustryBenchmark(String industry);

	List<String> listSupportedIndustries();

	List<IndustryBenchmark> findIndustryBenchmarks();

	Optional<DsoComparison> compareToBenchmark(String industry, double currentDsoDays);

	RoiResults calculateAll(RoiInputs inputs, RoiAssumptions assumptions);

	/** Calculates with the configured assumptions. */
	RoiResults calculateAll(RoiInputs inputs);
}

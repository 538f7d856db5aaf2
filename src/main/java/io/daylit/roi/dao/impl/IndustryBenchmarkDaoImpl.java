package io.daylit.roi.dao.impl;

import static io.daylit.roi.util.ConstantUtility.BUSINESS_CONSUMER_SERVICES;
import static io.daylit.roi.util.ConstantUtility.CHEMICAL_SPECIALTY;
import static io.daylit.roi.util.ConstantUtility.HOSPITALS_HEALTHCARE;
import static io.daylit.roi.util.ConstantUtility.RETAIL_DISTRIBUTORS;

import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import io.daylit.roi.dao.IndustryBenchmarkDao;
import io.daylit.roi.vo.IndustryBenchmark;

/**
 * Working capital benchmarks per industry (Damodaran, NYU Stern, Jan 2025).
 * DSO = A/R to sales x 365.
 */
@Repository
public class IndustryBenchmarkDaoImpl implements IndustryBenchmarkDao {

	private static final List<IndustryBenchmark> BENCHMARKS = List.of(
		IndustryBenchmark.of(RETAIL_DISTRIBUTORS, 0.1216),          // 44 days
		IndustryBenchmark.of(CHEMICAL_SPECIALTY, 0.1764),           // 64 days
		IndustryBenchmark.of(HOSPITALS_HEALTHCARE, 0.1447),         // 53 days
		IndustryBenchmark.of(BUSINESS_CONSUMER_SERVICES, 0.1829));  // 67 days

	@Override
	public Optional<IndustryBenchmark> findByIndustry(String industry) {
		if (StringUtils.isBlank(industry)) {
			return Optional.empty();
		}
		return BENCHMARKS.stream().filter(b -> b.getIndustry().equals(industry)).findFirst();
	}

	@Override
	public List<IndustryBenchmark> findAll() {
		return BENCHMARKS;
	}
}

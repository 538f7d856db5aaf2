package io.daylit.roi.dao;

import java.util.List;
import java.util.Optional;

import io.daylit.roi.vo.IndustryBenchmark;

public interface IndustryBenchmarkDao {

	/** Exact, case-sensitive match on the industry name. */
	Optional<IndustryBenchmark> findByIndustry(String industry);

	List<IndustryBenchmark> findAll();
}

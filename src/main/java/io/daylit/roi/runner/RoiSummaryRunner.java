package io.daylit.roi.runner;

import java.io.PrintStream;
import java.util.Optional;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import io.daylit.roi.config.RoiClientProperties;
import io.daylit.roi.exception.ErrorMessageHandler;
import io.daylit.roi.exception.NotValidException;
import io.daylit.roi.helper.RoiSummaryFormatter;
import io.daylit.roi.service.RoiCalculationService;
import io.daylit.roi.vo.DsoComparison;
import io.daylit.roi.vo.RoiInputs;
import io.daylit.roi.vo.RoiResults;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Prints the ROI summary for the configured client on startup.
 */
@Component
@ConditionalOnProperty(prefix = "roi.summary", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RoiSummaryRunner implements CommandLineRunner {

	private final RoiCalculationService roiCalculationService;

	private final RoiClientProperties clientProperties;

	private final RoiSummaryFormatter formatter;

	private final ErrorMessageHandler errorMessageHandler;

	@Override
	public void run(String... args) {
		printSummary(clientProperties.toInputs(), System.out);
	}

	public void printSummary(RoiInputs inputs, PrintStream out) {
		formatter.formatIndustries(roiCalculationService.findIndustryBenchmarks()).forEach(out::println);
		out.println();

		RoiResults results;
		try {
			results = roiCalculationService.calculateAll(inputs);
		} catch (NotValidException ex) {
			log.error("ROI calculation rejected: {}", errorMessageHandler.createExceptionMessage(ex));
			throw ex;
		}
		Optional<DsoComparison> comparison = roiCalculationService.compareToBenchmark(inputs.getIndustry(),
			inputs.getCurrentDsoDays());
		if (comparison.isEmpty()) {
			log.info("No DSO benchmark for industry '{}'", inputs.getIndustry());
		}
		formatter.formatSummary(inputs.getIndustry(), comparison, results).forEach(out::println);
	}
}

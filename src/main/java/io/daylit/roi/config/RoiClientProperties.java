package io.daylit.roi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.daylit.roi.util.ConstantUtility;
import io.daylit.roi.vo.RoiInputs;
import lombok.Data;

/**
 * Client figures used by the console summary. Not validated: the calculation takes
 * inputs as given.
 */
@Data
@ConfigurationProperties(prefix = "roi.client")
public class RoiClientProperties {

	private String industry = ConstantUtility.HOSPITALS_HEALTHCARE;
	private double annualRevenue = 1_200_000;
	private int arHeadcount = 3;
	private double currentDsoDays = 65.0;
	private int monthlyInvoices = 5000;
	private double fteSalaryBase = 80_000.0;
	private double badDebtPct = 0.05;

	public RoiInputs toInputs() {
		return RoiInputs.builder()
			.industry(industry)
			.annualRevenue(annualRevenue)
			.arHeadcount(arHeadcount)
			.currentDsoDays(currentDsoDays)
			.monthlyInvoices(monthlyInvoices)
			.fteSalaryBase(fteSalaryBase)
			.badDebtPct(badDebtPct)
			.build();
	}
}

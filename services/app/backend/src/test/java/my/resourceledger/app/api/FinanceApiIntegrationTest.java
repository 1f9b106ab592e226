package my.resourceledger.app.api;

import my.resourceledger.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.resourceledger.app.AppApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
class FinanceApiIntegrationTest {
	@Autowired
	private MockMvc mockMvc;

	@Autowired
	private JdbcTemplate jdbcTemplate;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	@BeforeEach
	void setUp() {
		databaseCleaner.clean();
		LocalDateTime now = LocalDateTime.now();
		jdbcTemplate.update("insert into financial_resources (resource_name, activity_type_cap, activity_type_opx, contract_type, employee_id, created_at, updated_at) "
				+ "values ('Aroha Ngata', 'N3_CAP', 'N3_OPX', 'FTE', '2001', ?, ?)", now, now);
		Long resourceId = jdbcTemplate.queryForObject("select resource_id from financial_resources where employee_id = '2001'", Long.class);

		jdbcTemplate.update("insert into financial_workstreams (project_id, workstream_name, wbse, wbse_desc) values ('PRJ-1', 'Platform', 'W-100', 'Platform build')");
		jdbcTemplate.update("insert into project_financial_detail (project_id, wbse, wbse_desc, original_budget, forecast_budget, actual_cost) "
				+ "values ('PRJ-1', 'W-100', 'Platform build', 5000, 900, 0)");
		jdbcTemplate.update("insert into project_financial_detail (project_id, wbse, wbse_desc, original_budget, forecast_budget, actual_cost) "
				+ "values ('PRJ-2', 'W-200', null, 8000, 4000, 4400)");
		jdbcTemplate.update("insert into labour_rates (band, activity_type, fiscal_year, hourly_rate, daily_rate, imported_at) "
				+ "values ('N3', 'N3_CAP', 'FY24', 90, 720, ?)", now);
		jdbcTemplate.update("insert into labour_rates (band, activity_type, fiscal_year, hourly_rate, daily_rate, imported_at) "
				+ "values ('N3', 'N3_CAP', 'FY25', 100, 800, ?)", now);
		jdbcTemplate.update("insert into feature_allocations (allocation_id, resource_id, feature_id, project_id, allocated_hours) "
				+ "values (?, ?, 'FEAT-1', 'PRJ-1', 10)", UUID.randomUUID(), resourceId);
		insertActual("2025-02", LocalDate.of(2025, 2, 12), "200");
		insertActual("2025-03", LocalDate.of(2025, 3, 4), "1000");
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void ledgerComparesActualsWithLabourForecast() throws Exception {
		mockMvc.perform(get("/api/finance/ledger").param("projectId", "PRJ-1"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(1)))
				.andExpect(jsonPath("$[0].workstream").value("Platform"))
				.andExpect(jsonPath("$[0].budget").value(5000.0))
				.andExpect(jsonPath("$[0].forecast").value(1000.0))
				.andExpect(jsonPath("$[0].actual").value(1200.0))
				.andExpect(jsonPath("$[0].variance").value(200.0))
				.andExpect(jsonPath("$[0].variancePercent").value(20.0));
	}

	@Test
	void ledgerCanBeRestrictedToMonth() throws Exception {
		mockMvc.perform(get("/api/finance/ledger").param("projectId", "PRJ-1").param("month", "2025-03"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$[0].actual").value(1000.0))
				.andExpect(jsonPath("$[0].variance").value(0.0));
	}

	@Test
	void projectWithoutWorkstreamsShowsProjectTotal() throws Exception {
		mockMvc.perform(get("/api/finance/ledger").param("projectId", "PRJ-2"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", hasSize(1)))
				.andExpect(jsonPath("$[0].workstream").value("Project Total"))
				.andExpect(jsonPath("$[0].variancePercent").value(10.0));
	}

	@Test
	void summaryTotalsLedger() throws Exception {
		mockMvc.perform(get("/api/finance/summary").param("projectId", "PRJ-1"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.totalForecast").value(1000.0))
				.andExpect(jsonPath("$.totalActual").value(1200.0))
				.andExpect(jsonPath("$.totalVariancePercent").value(20.0));
	}

	@Test
	void workstreamLookupByWbse() throws Exception {
		mockMvc.perform(get("/api/finance/workstreams/{wbse}", "W-100"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.wbse").value("W-100"));
		mockMvc.perform(get("/api/finance/workstreams/{wbse}", "W-999"))
				.andExpect(status().isNotFound());
	}

	@Test
	void monthsAreListedNewestFirst() throws Exception {
		mockMvc.perform(get("/api/finance/months"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$", contains("2025-03", "2025-02")));
	}

	private void insertActual(String month, LocalDate postingDate, String amount) {
		jdbcTemplate.update("insert into raw_actuals (period_month, posting_date, cost_element, wbs_element, amount, imported_at) "
						+ "values (?, ?, '400100', 'W-100', ?, ?)",
				month, postingDate, new BigDecimal(amount), LocalDateTime.now());
	}
}

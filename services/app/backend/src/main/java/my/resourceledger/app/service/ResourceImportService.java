package my.resourceledger.app.service;

import my.resourceledger.app.domain.ContractType;
import my.resourceledger.app.domain.ContractTypeConverter;
import my.resourceledger.app.domain.FinancialResource;
import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.importer.CsvImportOptions;
import my.resourceledger.app.importer.CsvRow;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.persistence.ImportBatchWriter;
import my.resourceledger.app.util.FieldParsers;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Imports the resource master list. Rows carrying an employee ID merge into the existing
 * resource with that ID; rows without one are always added.
 */
@Service
public class ResourceImportService extends AbstractCsvImportService<FinancialResource> {
	static final String RESOURCE_NAME = "ResourceName";
	static final String CONTRACT_TYPE = "Contract Type";
	static final String ROADMAP_ID = "Roadmap_ResourceID";
	static final String ACTIVITY_TYPE_CAP = "ActivityType_CAP";
	static final String ACTIVITY_TYPE_OPX = "ActivityType_OPX";
	static final String EMPLOYEE_ID = "EmployeeID";
	static final List<String> REQUIRED_FIELDS = List.of(RESOURCE_NAME, CONTRACT_TYPE);

	private static final Pattern ACTIVITY_TYPE = Pattern.compile("^N[1-6]_(CAP|OPX)$");
	private static final String NO_ACTIVITY_TYPE = "Nil";
	private static final ContractTypeConverter CONTRACT_TYPES = new ContractTypeConverter();

	private static final String FIND_BY_EMPLOYEE_SQL =
			"select resource_id from financial_resources where employee_id = :employeeId";
	private static final String INSERT_SQL = """
			insert into financial_resources (roadmap_resource_id, resource_name, email, work_area,
			    activity_type_cap, activity_type_opx, contract_type, employee_id, created_at, updated_at)
			values (:roadmapResourceId, :resourceName, :email, :workArea,
			    :activityTypeCap, :activityTypeOpx, :contractType, :employeeId, :now, :now)
			""";
	private static final String UPDATE_SQL = """
			update financial_resources
			set roadmap_resource_id = :roadmapResourceId,
			    resource_name = :resourceName,
			    email = :email,
			    work_area = :workArea,
			    activity_type_cap = :activityTypeCap,
			    activity_type_opx = :activityTypeOpx,
			    contract_type = :contractType,
			    updated_at = :now
			where resource_id = :resourceId
			""";

	private final NamedParameterJdbcTemplate namedParameterJdbcTemplate;

	public ResourceImportService(ImportBatchWriter batchWriter, NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
		super(batchWriter);
		this.namedParameterJdbcTemplate = namedParameterJdbcTemplate;
	}

	@Transactional
	public ImportResultDto importResources(String csvText) {
		CsvImportOptions options = CsvImportOptions.of(REQUIRED_FIELDS, this::validate);
		return runImport(csvText, options, this::toResource, null);
	}

	@Override
	protected String importName() {
		return "Resource";
	}

	@Override
	protected void insert(FinancialResource resource) {
		MapSqlParameterSource params = new MapSqlParameterSource()
				.addValue("roadmapResourceId", resource.getRoadmapResourceId())
				.addValue("resourceName", resource.getResourceName())
				.addValue("email", resource.getEmail())
				.addValue("workArea", resource.getWorkArea())
				.addValue("activityTypeCap", resource.getActivityTypeCap())
				.addValue("activityTypeOpx", resource.getActivityTypeOpx())
				.addValue("contractType", CONTRACT_TYPES.convertToDatabaseColumn(resource.getContractType()))
				.addValue("employeeId", resource.getEmployeeId())
				.addValue("now", Timestamp.valueOf(LocalDateTime.now()));

		Long existingId = null;
		if (resource.getEmployeeId() != null) {
			List<Long> matches = namedParameterJdbcTemplate.queryForList(FIND_BY_EMPLOYEE_SQL, params, Long.class);
			existingId = matches.isEmpty() ? null : matches.get(0);
		}
		if (existingId == null) {
			namedParameterJdbcTemplate.update(INSERT_SQL, params);
		} else {
			namedParameterJdbcTemplate.update(UPDATE_SQL, params.addValue("resourceId", existingId));
		}
	}

	List<ImportIssue> validate(CsvRow row) {
		List<ImportIssue> issues = new ArrayList<>();
		if (row.isBlank(RESOURCE_NAME)) {
			issues.add(ImportIssue.error(row.rowNumber(), RESOURCE_NAME, row.get(RESOURCE_NAME),
					"Resource name is required"));
		}

		String contractType = row.get(CONTRACT_TYPE);
		if (!contractType.isBlank() && ContractType.fromLabel(contractType).isEmpty()) {
			issues.add(ImportIssue.error(row.rowNumber(), CONTRACT_TYPE, contractType,
					"Invalid Contract Type: \"" + contractType + "\". Must be one of: FTE, SOW, External Squad"));
		}

		validateActivityType(row, ACTIVITY_TYPE_CAP, "CAP", issues);
		validateActivityType(row, ACTIVITY_TYPE_OPX, "OPX", issues);

		String roadmapId = row.get(ROADMAP_ID);
		if (!roadmapId.isBlank() && FieldParsers.parseInteger(roadmapId) == null) {
			issues.add(ImportIssue.warning(row.rowNumber(), ROADMAP_ID, roadmapId,
					"Roadmap resource ID is not an integer and was ignored"));
		}
		return issues;
	}

	private void validateActivityType(CsvRow row, String field, String suffix, List<ImportIssue> issues) {
		String value = row.get(field);
		if (value.isBlank() || NO_ACTIVITY_TYPE.equals(value)) {
			return;
		}
		if (!ACTIVITY_TYPE.matcher(value).matches()) {
			issues.add(ImportIssue.error(row.rowNumber(), field, value,
					"Invalid " + field + ": \"" + value + "\". Must match N[1-6]_" + suffix + " format"));
		}
	}

	private FinancialResource toResource(CsvRow row) {
		FinancialResource resource = new FinancialResource();
		resource.setRoadmapResourceId(FieldParsers.parseInteger(row.get(ROADMAP_ID)));
		resource.setResourceName(row.get(RESOURCE_NAME));
		resource.setEmail(FieldParsers.trimToNull(row.get("Email")));
		resource.setWorkArea(FieldParsers.trimToNull(row.get("WorkArea")));
		resource.setActivityTypeCap(activityType(row.get(ACTIVITY_TYPE_CAP)));
		resource.setActivityTypeOpx(activityType(row.get(ACTIVITY_TYPE_OPX)));
		resource.setContractType(ContractType.fromLabel(row.get(CONTRACT_TYPE)).orElse(null));
		resource.setEmployeeId(FieldParsers.trimToNull(row.get(EMPLOYEE_ID)));
		return resource;
	}

	private static String activityType(String raw) {
		return NO_ACTIVITY_TYPE.equals(raw) ? null : FieldParsers.trimToNull(raw);
	}
}

package my.resourceledger.app.service;

import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.importer.ImportIssue;
import my.resourceledger.app.support.DirectImportBatchWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResourceImportServiceTest {
	private static final String HEADER = "Roadmap_ResourceID,ResourceName,Email,WorkArea,ActivityType_CAP,ActivityType_OPX,Contract Type,EmployeeID\n";

	@Mock
	private NamedParameterJdbcTemplate namedParameterJdbcTemplate;

	private ResourceImportService service;

	@BeforeEach
	void setUp() {
		service = new ResourceImportService(new DirectImportBatchWriter(), namedParameterJdbcTemplate);
	}

	@Test
	void insertsNewResourceWhenEmployeeIdUnknown() {
		String csv = HEADER + "12,Jane Doe,jane@example.com,Payments,N3_CAP,N3_OPX,FTE,1001\n";
		when(namedParameterJdbcTemplate.queryForList(anyString(), any(MapSqlParameterSource.class), eq(Long.class)))
				.thenReturn(List.of());

		ImportResultDto result = service.importResources(csv);

		assertThat(result.recordsImported()).isEqualTo(1);
		ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
		verify(namedParameterJdbcTemplate).update(startsWith("insert into financial_resources"), params.capture());
		assertThat(params.getValue().getValue("contractType")).isEqualTo("FTE");
		assertThat(params.getValue().getValue("roadmapResourceId")).isEqualTo(12);
		assertThat(params.getValue().getValue("employeeId")).isEqualTo("1001");
	}

	@Test
	void updatesExistingResourceWithSameEmployeeId() {
		String csv = HEADER + ",Jane Smith,,,Nil,N3_OPX,External Squad,1001\n";
		when(namedParameterJdbcTemplate.queryForList(anyString(), any(MapSqlParameterSource.class), eq(Long.class)))
				.thenReturn(List.of(7L));

		ImportResultDto result = service.importResources(csv);

		assertThat(result.recordsImported()).isEqualTo(1);
		ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
		verify(namedParameterJdbcTemplate).update(startsWith("update financial_resources"), params.capture());
		assertThat(params.getValue().getValue("resourceId")).isEqualTo(7L);
		assertThat(params.getValue().getValue("resourceName")).isEqualTo("Jane Smith");
		assertThat(params.getValue().getValue("activityTypeCap")).isNull();
		assertThat(params.getValue().getValue("contractType")).isEqualTo("External Squad");
		verify(namedParameterJdbcTemplate, never()).update(startsWith("insert"), any(MapSqlParameterSource.class));
	}

	@Test
	void rowsWithoutEmployeeIdAreAlwaysInserted() {
		String csv = HEADER + ",Vendor Team,,,,,SOW,\n";

		ImportResultDto result = service.importResources(csv);

		assertThat(result.recordsImported()).isEqualTo(1);
		verify(namedParameterJdbcTemplate, never()).queryForList(anyString(), any(MapSqlParameterSource.class), eq(Long.class));
		verify(namedParameterJdbcTemplate).update(startsWith("insert into financial_resources"), any(MapSqlParameterSource.class));
	}

	@Test
	void rejectsUnknownContractTypeAndBadActivityTypes() {
		String csv = HEADER
				+ ",Freelance Fred,,,,,Freelancer,3001\n"
				+ ",Bad Band,,,N7_CAP,X3_OPX,FTE,3002\n"
				+ ",   ,,,,,FTE,3003\n";

		ImportResultDto result = service.importResources(csv);

		assertThat(result.success()).isFalse();
		assertThat(result.recordsFailed()).isEqualTo(3);
		assertThat(result.errors()).extracting(ImportIssue::row, ImportIssue::field)
				.containsExactly(
						tuple(2, "Contract Type"),
						tuple(3, "ActivityType_CAP"),
						tuple(3, "ActivityType_OPX"),
						tuple(4, "ResourceName"));
	}

	@Test
	void nonIntegerRoadmapIdIsDroppedWithWarning() {
		String csv = HEADER + "R-12,Jane Doe,,,,,FTE,\n";

		ImportResultDto result = service.importResources(csv);

		assertThat(result.recordsImported()).isEqualTo(1);
		assertThat(result.warnings()).extracting(ImportIssue::field).containsExactly("Roadmap_ResourceID");
		ArgumentCaptor<MapSqlParameterSource> params = ArgumentCaptor.forClass(MapSqlParameterSource.class);
		verify(namedParameterJdbcTemplate).update(anyString(), params.capture());
		assertThat(params.getValue().getValue("roadmapResourceId")).isNull();
	}
}

package my.resourceledger.app.api;

import my.resourceledger.app.dto.CategorizationResultDto;
import my.resourceledger.app.dto.ImportResultDto;
import my.resourceledger.app.service.ActualsImportService;
import my.resourceledger.app.service.LabourRateImportService;
import my.resourceledger.app.service.PublicHolidayImportService;
import my.resourceledger.app.service.ResourceImportService;
import my.resourceledger.app.service.TimesheetImportService;
import my.resourceledger.app.util.CsvParsing;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api/imports")
public class ImportController {
	private final TimesheetImportService timesheetImportService;
	private final ActualsImportService actualsImportService;
	private final ResourceImportService resourceImportService;
	private final LabourRateImportService labourRateImportService;
	private final PublicHolidayImportService publicHolidayImportService;

	public ImportController(TimesheetImportService timesheetImportService,
							ActualsImportService actualsImportService,
							ResourceImportService resourceImportService,
							LabourRateImportService labourRateImportService,
							PublicHolidayImportService publicHolidayImportService) {
		this.timesheetImportService = timesheetImportService;
		this.actualsImportService = actualsImportService;
		this.resourceImportService = resourceImportService;
		this.labourRateImportService = labourRateImportService;
		this.publicHolidayImportService = publicHolidayImportService;
	}

	@PostMapping(path = "/timesheets", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ImportResultDto importTimesheets(@RequestParam("file") MultipartFile file) {
		return timesheetImportService.importTimesheets(readText(file));
	}

	@PostMapping(path = "/actuals", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ImportResultDto importActuals(@RequestParam("file") MultipartFile file) {
		return actualsImportService.importActuals(readText(file));
	}

	@PostMapping("/actuals/categorize")
	public CategorizationResultDto categorizeActuals() {
		return actualsImportService.categorizeActuals();
	}

	@PostMapping(path = "/resources", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ImportResultDto importResources(@RequestParam("file") MultipartFile file) {
		return resourceImportService.importResources(readText(file));
	}

	@PostMapping(path = "/labour-rates", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ImportResultDto importLabourRates(@RequestParam("file") MultipartFile file,
											 @RequestParam("fiscalYear") String fiscalYear) {
		return labourRateImportService.importLabourRates(readText(file), fiscalYear);
	}

	@PostMapping(path = "/holidays", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	public ImportResultDto importHolidays(@RequestParam("file") MultipartFile file) {
		return publicHolidayImportService.importHolidays(readText(file));
	}

	private String readText(MultipartFile file) {
		try {
			return CsvParsing.decodeUtf8(file.getBytes());
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read upload: " + exc.getMessage(), exc);
		}
	}
}

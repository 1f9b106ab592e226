package my.resourceledger.app.api;

import my.resourceledger.app.dto.FinanceLedgerRowDto;
import my.resourceledger.app.dto.FinanceSummaryDto;
import my.resourceledger.app.service.FinanceLedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/finance")
public class FinanceController {
	private final FinanceLedgerService financeLedgerService;

	public FinanceController(FinanceLedgerService financeLedgerService) {
		this.financeLedgerService = financeLedgerService;
	}

	@GetMapping("/ledger")
	public List<FinanceLedgerRowDto> ledger(@RequestParam(required = false) String projectId,
											@RequestParam(required = false) String month) {
		return financeLedgerService.getFinanceLedger(projectId, month);
	}

	@GetMapping("/summary")
	public FinanceSummaryDto summary(@RequestParam(required = false) String projectId,
									 @RequestParam(required = false) String month) {
		return financeLedgerService.getFinanceSummary(projectId, month);
	}

	@GetMapping("/workstreams/{wbse}")
	public ResponseEntity<FinanceLedgerRowDto> workstream(@PathVariable String wbse) {
		return financeLedgerService.getWorkstreamFinance(wbse)
				.map(ResponseEntity::ok)
				.orElseGet(() -> ResponseEntity.notFound().build());
	}

	@GetMapping("/months")
	public List<String> months() {
		return financeLedgerService.getAvailableMonths();
	}
}

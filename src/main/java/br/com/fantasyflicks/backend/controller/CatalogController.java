package br.com.fantasyflicks.backend.controller;

import br.com.fantasyflicks.backend.dto.CatalogItemRequest;
import br.com.fantasyflicks.backend.dto.CatalogPoolDTO;
import br.com.fantasyflicks.backend.dto.CatalogPoolRequest;
import br.com.fantasyflicks.backend.dto.ItemResultRequest;
import br.com.fantasyflicks.backend.service.catalog.CatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/catalog/pools")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogService catalogService;

    @PutMapping("/{poolId}")
    public ResponseEntity<CatalogPoolDTO> replacePool(
            @PathVariable String poolId,
            @Valid @RequestBody CatalogPoolRequest request) {
        log.info("📦 Atualizando pool {}: {} itens", poolId, request.getItems().size());
        return ResponseEntity.ok(catalogService.replacePool(poolId, request));
    }

    @GetMapping("/{poolId}")
    public ResponseEntity<CatalogPoolDTO> getPool(@PathVariable String poolId) {
        return ResponseEntity.ok(catalogService.getPool(poolId));
    }

    @PutMapping("/{poolId}/items/{itemId}/result")
    public ResponseEntity<CatalogItemRequest> recordResult(
            @PathVariable String poolId,
            @PathVariable String itemId,
            @RequestBody ItemResultRequest request) {
        return ResponseEntity.ok(catalogService.recordResult(poolId, itemId, request));
    }
}

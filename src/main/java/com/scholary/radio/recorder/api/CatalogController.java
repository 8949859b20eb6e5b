package com.scholary.radio.recorder.api;

import com.scholary.radio.recorder.catalog.CatalogEntry;
import com.scholary.radio.recorder.catalog.CatalogReconciler;
import com.scholary.radio.recorder.catalog.CatalogRegistrar;
import com.scholary.radio.recorder.catalog.CatalogRepository;
import com.scholary.radio.recorder.catalog.RescanReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API over the recordings catalog.
 *
 * <p>Entries are addressed by their path relative to the output directory.
 */
@RestController
@RequestMapping("/api/catalog")
@Validated
@Tag(name = "Catalog", description = "Recorded files")
public class CatalogController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CatalogController.class);

  private final CatalogRepository catalogRepository;
  private final CatalogRegistrar catalogRegistrar;
  private final CatalogReconciler catalogReconciler;

  public CatalogController(
      CatalogRepository catalogRepository,
      CatalogRegistrar catalogRegistrar,
      CatalogReconciler catalogReconciler) {
    this.catalogRepository = catalogRepository;
    this.catalogRegistrar = catalogRegistrar;
    this.catalogReconciler = catalogReconciler;
  }

  @GetMapping
  @Operation(summary = "List recordings", description = "Newest file first")
  public ResponseEntity<List<CatalogEntry>> list(
      @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
      @RequestParam(defaultValue = "0") @Min(0) int offset) {
    return ResponseEntity.ok(catalogRepository.findAll(limit, offset));
  }

  @GetMapping("/search")
  @Operation(summary = "Search recordings")
  public ResponseEntity<List<CatalogEntry>> search(
      @RequestParam(required = false) String keyword,
      @RequestParam(required = false) String stationId,
      @RequestParam(required = false) String from,
      @RequestParam(required = false) String to,
      @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
    return ResponseEntity.ok(catalogRepository.search(keyword, stationId, from, to, limit));
  }

  @DeleteMapping
  @Operation(
      summary = "Delete catalog entry",
      description = "Removes the entry only; the file on disk is left alone")
  public ResponseEntity<Void> delete(@RequestParam String filePath) {
    return catalogRegistrar.delete(filePath)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }

  @PutMapping("/folder")
  @Operation(summary = "Move to virtual folder")
  public ResponseEntity<Void> moveToFolder(@Valid @RequestBody MoveToFolderRequest request) {
    if (!catalogRepository.moveToFolder(request.filePath(), request.folderId())) {
      return ResponseEntity.notFound().build();
    }
    LOGGER.info("Moved {} to folder {}", request.filePath(), request.folderId());
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/rescan")
  @Operation(
      summary = "Rescan output directory",
      description = "Register recordings on disk that have no catalog entry")
  public ResponseEntity<RescanReport> rescan() {
    try {
      return ResponseEntity.ok(catalogReconciler.rescan());
    } catch (IOException e) {
      LOGGER.error("Catalog rescan failed", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }
}

package com.stereoselect.controller;

import com.stereoselect.aspect.TimingAspect;
import com.stereoselect.config.SelectionProperties;
import com.stereoselect.exception.ConfigurationException;
import com.stereoselect.export.ExportFormat;
import com.stereoselect.export.ResultExporter;
import com.stereoselect.model.SelectionParams;
import com.stereoselect.model.param.SelectionRequest;
import com.stereoselect.model.result.ApiResponse;
import com.stereoselect.model.result.SelectionResult;
import com.stereoselect.model.result.SelectionResultData;
import com.stereoselect.service.SelectionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Paths;

/**
 * REST API controller for stereo pair and multilook group selection
 */
@RestController
@RequestMapping("/api/v1/selection")
@Slf4j
public class SelectionController {

    @Autowired
    private SelectionService selectionService;

    @Autowired
    private SelectionProperties selectionProperties;

    @Autowired
    private ResultExporter resultExporter;

    /**
     * Select two-scene stereo pairs over the whole repository
     * HTTP: POST /api/v1/selection/stereo
     */
    @PostMapping("/stereo")
    public ResponseEntity<ApiResponse<SelectionResultData>> selectStereo(
            @RequestBody(required = false) SelectionRequest request) {

        SelectionRequest effective = request != null ? request : new SelectionRequest();
        try {
            SelectionParams params = effective.toParams(selectionProperties.toParams());
            SelectionResult<?> result = selectionService.selectStereoPairs(params);
            return respond(result, effective);
        } catch (ConfigurationException e) {
            log.warn("Rejected stereo selection: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Stereo selection failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error("Stereo selection failed: " + e.getMessage()));
        }
    }

    /**
     * Select multilook groups, optionally from the request's anchors only
     * HTTP: POST /api/v1/selection/multilook
     */
    @PostMapping("/multilook")
    public ResponseEntity<ApiResponse<SelectionResultData>> selectMultilook(
            @RequestBody(required = false) SelectionRequest request) {

        SelectionRequest effective = request != null ? request : new SelectionRequest();
        try {
            SelectionParams params = effective.toParams(selectionProperties.toParams());
            SelectionResult<?> result = effective.getAnchorIds() != null
                    ? selectionService.selectMultilookGroups(params, effective.getAnchorIds())
                    : selectionService.selectMultilookGroups(params);
            return respond(result, effective);
        } catch (ConfigurationException e) {
            log.warn("Rejected multilook selection: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("Multilook selection failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ApiResponse.error("Multilook selection failed: " + e.getMessage()));
        }
    }

    private ResponseEntity<ApiResponse<SelectionResultData>> respond(SelectionResult<?> result,
                                                                     SelectionRequest request) {
        String elapsed = TimingAspect.getAndClearExecutionTime();
        String exported = null;
        if (request.hasExport()) {
            ExportFormat format = request.getExportFormat() != null ? request.getExportFormat() : ExportFormat.GEOJSON;
            exported = resultExporter.export(result.getRows(), format, Paths.get(request.getExportPath())).toString();
        }
        return ResponseEntity.ok(ApiResponse.success(SelectionResultData.of(result, exported), elapsed));
    }
}

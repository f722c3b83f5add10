package com.lohika.morning.risk.api.controller;

import com.lohika.morning.risk.api.service.RiskService;
import com.lohika.morning.risk.spark.driver.error.NoInputDataException;
import com.lohika.morning.risk.spark.driver.error.SchemaMismatchException;
import com.lohika.morning.risk.spark.driver.error.UnreadableFileException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    @Autowired
    private RiskService riskService;

    @RequestMapping(value = "/prediction", method = RequestMethod.GET)
    ResponseEntity<?> prediction(@RequestParam(value = "filepath", required = true) String filepath) {
        try {
            log.info("Received /prediction request for {}", filepath);
            List<Integer> predictions = riskService.predict(filepath);
            return new ResponseEntity<>(predictions, HttpStatus.OK);
        } catch (UnreadableFileException | SchemaMismatchException | NoInputDataException e) {
            log.error("Bad request for predictions on {}: {}", filepath, e.getMessage());
            return new ResponseEntity<>(error(e.getMessage()), HttpStatus.BAD_REQUEST);
        } catch (Exception e) {
            log.error("Internal server error predicting {}: {}", filepath, e.getMessage(), e);
            return new ResponseEntity<>(error("Internal server error during prediction."), HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    @RequestMapping(value = "/scoring", method = RequestMethod.GET, produces = MediaType.TEXT_PLAIN_VALUE)
    ResponseEntity<String> scoring() {
        try {
            return new ResponseEntity<>(riskService.latestScore(), HttpStatus.OK);
        } catch (Exception e) {
            log.error("Internal server error reading score: {}", e.getMessage(), e);
            return new ResponseEntity<>("Internal server error reading score.", HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    @RequestMapping(value = "/summarystats", method = RequestMethod.GET)
    ResponseEntity<?> summaryStatistics() {
        try {
            return new ResponseEntity<>(riskService.summaryStatistics(), HttpStatus.OK);
        } catch (Exception e) {
            log.error("Internal server error computing summary statistics: {}", e.getMessage(), e);
            return new ResponseEntity<>(error("Internal server error computing summary statistics."), HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    @RequestMapping(value = "/diagnostics", method = RequestMethod.GET)
    ResponseEntity<Map<String, Object>> diagnostics() {
        try {
            return new ResponseEntity<>(riskService.diagnostics(), HttpStatus.OK);
        } catch (Exception e) {
            log.error("Internal server error collecting diagnostics: {}", e.getMessage(), e);
            return new ResponseEntity<>(error("Internal server error collecting diagnostics."), HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", message);
        return errorResponse;
    }
}

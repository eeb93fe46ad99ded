package dev.devanks.solarprofile.pipeline.client;

import dev.devanks.solarprofile.pipeline.config.MonitoringApiClientConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.Map;

/**
 * Feign client for the public monitoring API. Bodies are returned raw: the site listing is
 * not reliably valid JSON and goes through the tolerant decoder.
 * Headers are added by MonitoringApiClientConfig.
 */
@FeignClient(name = "monitoring-api",
        url = "${pipeline.api.base-url}",
        configuration = MonitoringApiClientConfig.class)
public interface MonitoringApiClient {

    @GetMapping("${pipeline.api.sites-path}")
    String listSites(@RequestParam("start") int start,
                     @RequestParam("limit") int limit,
                     @RequestParam Map<String, String> fixedParams);

    @GetMapping("${pipeline.api.export-path}")
    byte[] exportChart(@PathVariable("siteId") long siteId,
                       @RequestParam("st") long startEpochMillis,
                       @RequestParam("et") long endEpochMillis,
                       @RequestParam("fid") long fid,
                       @RequestParam Map<String, String> fixedParams);
}

package com.bit.deposit.api;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.info.BuildProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 构建版本，取自打包时生成的 build-info
 */
@RestController
@RequestMapping("/version")
public class VersionApi {

    static final String UNKNOWN_VERSION = "unknown";

    @Autowired
    private ObjectProvider<BuildProperties> buildProperties;

    @GetMapping
    public String version() {
        BuildProperties build = buildProperties.getIfAvailable();
        return build != null ? build.getVersion() : UNKNOWN_VERSION;
    }

}

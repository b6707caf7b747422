package com.afsun.schemagraph.controller;


import com.afsun.schemagraph.export.SchemaGraphJsonWriter;
import com.afsun.schemagraph.service.AnalysisResult;
import com.afsun.schemagraph.service.SchemaAnalysisService;
import com.afsun.schemagraph.service.SchemaGraphSession;
import com.afsun.schemagraph.source.dto.SchemaDescription;
import com.afsun.schemagraph.source.jdbc.SchemaConnectorRegistry;
import com.afsun.schemagraph.vo.Response;
import com.alibaba.druid.DbType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import javax.annotation.Resource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Schema关系分析API控制器
 * 业务异常统一交给 GlobalExceptionHandler 处理
 *
 * @author afsun
 */
@RestController
@RequestMapping("/schema/analyzer")
@Slf4j
public class SchemaAnalyzerController {

    @Resource
    private SchemaAnalysisService schemaAnalysisService;

    @Resource
    private SchemaConnectorRegistry schemaConnectorRegistry;

    @Resource
    private SchemaGraphJsonWriter schemaGraphJsonWriter;

    @Resource
    private ObjectMapper objectMapper;

    /**
     * 文件及文本大小限制（字节），默认10MB
     */
    @Value("${schema.graph.max-file-size:10485760}")
    private long maxFileSize;

    /**
     * 分析JSON格式的Schema描述
     *
     * @param description Schema描述
     * @return 推断关系、Schema图和警告信息
     */
    @PostMapping("/analyze")
    public Response<AnalysisResult> analyze(@RequestBody SchemaDescription description) {
        log.info("开始分析Schema描述: database={}", description.getDatabase());
        return Response.success(schemaAnalysisService.analyze(description));
    }

    /**
     * 分析DDL脚本文本
     *
     * @param ddl    DDL脚本
     * @param dbType 数据库类型，为空时自动检测
     */
    @PostMapping("/analyze/ddl")
    public Response<AnalysisResult> analyzeDdl(@RequestBody String ddl,
                                               @RequestParam(value = "dbType", required = false) String dbType) {
        // 1. 参数校验
        if (StringUtils.isBlank(ddl)) {
            return Response.fail(400, "DDL文本不能为空");
        }
        // 2. 长度检查
        if (ddl.length() > maxFileSize) {
            return Response.fail(413, String.format("DDL文本长度超过限制：%d > %d", ddl.length(), maxFileSize));
        }
        log.info("开始分析DDL文本，长度: {} 字符, dbType: {}", ddl.length(), dbType);
        AnalysisResult result = schemaAnalysisService.analyzeDdl(ddl, parseDbType(dbType));
        log.info("DDL分析成功, traceId: {}, 耗时: {}ms", result.getTraceId(), result.getElapsedMillis());
        return Response.success(result);
    }

    /**
     * 上传 .sql（DDL脚本）或 .json（Schema描述）文件进行分析
     *
     * @param file UTF-8编码的文件
     */
    @PostMapping("/upload")
    public Response<AnalysisResult> upload(@RequestParam("file") MultipartFile file,
                                           @RequestParam(value = "dbType", required = false) String dbType)
            throws IOException {
        // 1. 参数校验
        if (file == null || file.isEmpty()) {
            return Response.fail(400, "文件不能为空");
        }

        // 2. 文件大小检查
        if (file.getSize() > maxFileSize) {
            return Response.fail(413, String.format("文件大小超过限制：%.2fMB > %.2fMB",
                file.getSize() / 1024.0 / 1024.0, maxFileSize / 1024.0 / 1024.0));
        }

        // 3. 文件名校验
        String filename = file.getOriginalFilename();
        if (filename == null || filename.trim().isEmpty()) {
            return Response.fail(400, "文件名无效");
        }

        log.info("开始分析文件: {}, 大小: {} bytes", filename, file.getSize());
        String content = new String(file.getBytes(), StandardCharsets.UTF_8);
        String lower = filename.toLowerCase(Locale.ROOT);
        AnalysisResult result;
        if (lower.endsWith(".sql")) {
            result = schemaAnalysisService.analyzeDdl(content, parseDbType(dbType));
        } else if (lower.endsWith(".json")) {
            result = schemaAnalysisService.analyze(readDescription(content));
        } else {
            return Response.fail(400, "仅支持 .sql 或 .json 文件: " + filename);
        }
        log.info("文件分析成功: {}, traceId: {}, 耗时: {}ms", filename, result.getTraceId(), result.getElapsedMillis());
        return Response.success(result);
    }

    /**
     * 通过已配置的数据源在线抽取并分析
     *
     * @param name schema.graph.datasources 中的数据源名称
     */
    @PostMapping("/analyze/datasource/{name}")
    public Response<AnalysisResult> analyzeDataSource(@PathVariable("name") String name) {
        log.info("开始分析数据源: {}", name);
        return Response.success(schemaAnalysisService.analyzeDataSource(name));
    }

    /**
     * 只输出YAML格式的关系结果
     */
    @PostMapping("/relationships")
    public Response<String> relationships(@RequestBody SchemaDescription description) {
        SchemaGraphSession session = schemaAnalysisService.newSession().load(description);
        session.inferRelationships();
        return Response.success(session.toYaml());
    }

    /**
     * 只输出 node-link 格式的Schema图
     */
    @PostMapping("/graph")
    public Response<Map<String, Object>> graph(@RequestBody SchemaDescription description) {
        SchemaGraphSession session = schemaAnalysisService.newSession().load(description);
        session.inferRelationships();
        return Response.success(schemaGraphJsonWriter.toNodeLink(session.buildGraph()));
    }

    /**
     * 已注册连接器的数据库类型
     */
    @GetMapping("/connectors")
    public Response<List<String>> connectors() {
        return Response.success(schemaConnectorRegistry.registeredTypes().stream()
                .map(DbType::name)
                .collect(Collectors.toList()));
    }

    private SchemaDescription readDescription(String content) {
        try {
            return objectMapper.readValue(content, SchemaDescription.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON格式错误: " + e.getOriginalMessage(), e);
        }
    }

    private static DbType parseDbType(String dbType) {
        if (StringUtils.isBlank(dbType)) {
            return null;
        }
        try {
            return DbType.valueOf(dbType.trim().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未知的数据库类型: " + dbType, e);
        }
    }
}

package com.afsun.schemagraph.controller.handler;

import com.afsun.schemagraph.core.exceptions.InvalidSchemaException;
import com.afsun.schemagraph.core.exceptions.SchemaGraphException;
import com.afsun.schemagraph.core.exceptions.SchemaSourceException;
import com.afsun.schemagraph.vo.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * 全局异常处理器
 * 将Schema分析过程中的异常统一转换为 Response 响应
 *
 * @author afsun
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 处理Schema不合法异常（重名、缺少列名/类型、主键或外键源列不存在）
     */
    @ExceptionHandler(InvalidSchemaException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleInvalidSchemaException(InvalidSchemaException e) {
        log.warn("Schema不合法: {}", e.getMessage());
        return Response.fail(400, e.getFormattedMessage());
    }

    /**
     * 处理Schema来源异常（DDL解析失败、方言不支持、数据源抽取失败）
     */
    @ExceptionHandler(SchemaSourceException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Response<Void> handleSchemaSourceException(SchemaSourceException e) {
        log.warn("Schema读取失败: {}", e.getMessage());
        return Response.fail(422, e.getFormattedMessage());
    }

    /**
     * 处理其他已封装的内部异常
     */
    @ExceptionHandler(SchemaGraphException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleSchemaGraphException(SchemaGraphException e) {
        log.error("Schema分析内部错误", e);
        return Response.fail(500, "分析失败: " + e.getMessage());
    }

    /**
     * 处理请求体无法解析（JSON格式错误）
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        log.warn("请求体无法解析: {}", e.getMessage());
        return Response.fail(400, "请求体格式错误: " + e.getMostSpecificCause().getMessage());
    }

    /**
     * 处理文件上传大小超限异常
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    @ResponseStatus(HttpStatus.PAYLOAD_TOO_LARGE)
    public Response<Void> handleMaxUploadSizeExceededException(MaxUploadSizeExceededException e) {
        log.warn("文件上传大小超限: {}", e.getMessage());
        return Response.fail(413, "文件大小超过限制，请上传较小的文件");
    }

    /**
     * 处理非法参数异常
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Response<Void> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("非法参数: {}", e.getMessage());
        return Response.fail(400, "参数错误: " + e.getMessage());
    }

    /**
     * 处理其他未预期异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Response<Void> handleException(Exception e) {
        log.error("系统异常", e);
        return Response.fail(500, "系统错误: " + e.getMessage() +
                           "\n请联系技术支持");
    }
}

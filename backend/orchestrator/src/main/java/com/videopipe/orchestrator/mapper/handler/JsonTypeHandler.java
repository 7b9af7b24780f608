package com.videopipe.orchestrator.mapper.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.videopipe.orchestrator.config.JacksonConfig;
import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * JSON 문자열 컬럼 ↔ 컬렉션 필드 변환.
 * 제네릭 타입이 지워지므로 XML 매퍼에서 typeHandler 로 명시해서 사용한다.
 */
public abstract class JsonTypeHandler<T> extends BaseTypeHandler<T> {

    private static final ObjectMapper OBJECT_MAPPER = JacksonConfig.createObjectMapper();

    private final TypeReference<? extends T> typeReference;

    protected JsonTypeHandler(TypeReference<? extends T> typeReference) {
        this.typeReference = typeReference;
    }

    /** 컬럼이 NULL 일 때 사용할 빈 값 */
    protected abstract T emptyValue();

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, T parameter, JdbcType jdbcType) throws SQLException {
        try {
            ps.setString(i, OBJECT_MAPPER.writeValueAsString(parameter));
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to serialize JSON column: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public T getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return parse(rs.getString(columnName));
    }

    @Override
    public T getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return parse(rs.getString(columnIndex));
    }

    @Override
    public T getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return parse(cs.getString(columnIndex));
    }

    private T parse(String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return emptyValue();
        }
        try {
            T value = OBJECT_MAPPER.readValue(json, typeReference);
            return value != null ? value : emptyValue();
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to parse JSON column: " + e.getOriginalMessage(), e);
        }
    }
}

/*
 * どこで: Notification サービス層
 * 何を: 無効化ペイロード (入れ子の Map/List/スカラー) と保存形式 JSON を相互変換する
 * なぜ: ペイロードの中身を解釈せず、そのまま保存/復元するため
 */
package com.inboxseq.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.inboxseq.notification.model.NotificationRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * 値として扱えるのは String / Boolean / Long / Double (有限値) / null と、それらを要素に持つ List と String キーの Map だけ。
 * 整数は常に Long、小数は常に Double で復元されるため、この範囲の値なら decode(encode(m)) は m と等しい。
 */
@Component
public class InvalidationCodec {

  private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE =
      new TypeReference<>() {};

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final ObjectReader payloadReader;

  public InvalidationCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.payloadReader =
        objectMapper.readerFor(PAYLOAD_TYPE).with(DeserializationFeature.USE_LONG_FOR_INTS);
  }

  /** キー順はそのまま保たれる。扱えない型の値を含む場合は書き込み前に失敗する。 */
  public String encode(Map<String, Object> invalidate) {
    Objects.requireNonNull(invalidate, "invalidate");
    checkValue(invalidate, "$");
    try {
      return objectMapper.writeValueAsString(invalidate);
    } catch (JsonProcessingException ex) {
      throw new InvalidationEncodingException("invalidation payload serialization failure", ex);
    }
  }

  /** 無効化ペイロードが未設定のレコードでは empty を返す。 */
  public Optional<Map<String, Object>> decode(NotificationRecord record) {
    if (!record.hasInvalidate()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(payloadReader.readValue(record.invalidateJson()));
    } catch (JsonProcessingException ex) {
      // 保存済みデータの破損は再試行しても回復しない
      throw new InvalidationEncodingException(
          "invalidation payload parse failure userId="
              + record.userId()
              + " notificationId="
              + record.notificationId(),
          ex);
    }
  }

  private void checkValue(Object value, String path) {
    if (value == null
        || value instanceof String
        || value instanceof Boolean
        || value instanceof Long) {
      return;
    }
    if (value instanceof Double d) {
      if (!Double.isFinite(d)) {
        throw unsupported(path, "non-finite double " + d);
      }
      return;
    }
    if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw unsupported(path, "map key " + describe(entry.getKey()));
        }
        checkValue(entry.getValue(), path + "." + key);
      }
      return;
    }
    if (value instanceof List<?> list) {
      for (int i = 0; i < list.size(); i++) {
        checkValue(list.get(i), path + "[" + i + "]");
      }
      return;
    }
    throw unsupported(path, describe(value));
  }

  private static InvalidationEncodingException unsupported(String path, String what) {
    return new InvalidationEncodingException(
        "invalidation payload serialization failure: unsupported " + what + " at " + path, null);
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}

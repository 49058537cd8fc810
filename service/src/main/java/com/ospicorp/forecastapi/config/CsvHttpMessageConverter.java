package com.ospicorp.forecastapi.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.Collection;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes a collection of records (data points, forecast rows) as CSV with a header line taken
 * from the element type. Read support is not provided.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Object> {
  private static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Object readInternal(@NonNull Class<?> clazz, @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Object object, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Collection<?> collection = (Collection<?>) object;
    CsvSchema schema = determineSchema(collection);
    SequenceWriter writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object element : collection) {
      writer.write(element);
    }
    writer.flush();
  }

  private CsvSchema determineSchema(Collection<?> collection) {
    for (Object element : collection) {
      if (element != null) {
        return mapper.schemaFor(element.getClass()).withHeader();
      }
    }
    return CsvSchema.emptySchema();
  }
}

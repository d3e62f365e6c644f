/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.scheddata.xml;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.List;

import javax.inject.Inject;
import javax.xml.XMLConstants;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.apache.scheddata.model.SchemaViolation;
import org.apache.scheddata.model.SchemaViolation.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.SAXParseException;

import static java.util.Objects.requireNonNull;

/**
 * Validates scheduling data documents against the bundled XML schema. Validation never stops at
 * the first problem; every warning and error is collected and handed back to the caller.
 */
public class SchemaValidator {
  private static final Logger LOG = LoggerFactory.getLogger(SchemaValidator.class);

  public static final String NAMESPACE =
      "http://scheddata.apache.org/xml/job_scheduling_data_1_0";

  static final String SCHEMA_RESOURCE = "job_scheduling_data_1_0.xsd";

  private final Schema schema;

  @Inject
  public SchemaValidator(Schema schema) {
    this.schema = requireNonNull(schema);
  }

  /**
   * Compiles the schema shipped alongside this class.
   *
   * @return The scheduling data schema.
   */
  public static Schema loadBundledSchema() {
    URL resource = SchemaValidator.class.getResource(SCHEMA_RESOURCE);
    if (resource == null) {
      throw new IllegalStateException("Missing schema resource " + SCHEMA_RESOURCE);
    }

    SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
    try {
      return factory.newSchema(resource);
    } catch (SAXException e) {
      throw new IllegalStateException("Invalid schema resource " + SCHEMA_RESOURCE, e);
    }
  }

  /**
   * Validates a document.
   *
   * @param xml Document text.
   * @return Every violation found, in the order reported. Empty if the document is valid.
   */
  public List<SchemaViolation> validate(String xml) {
    requireNonNull(xml);

    CollectingErrorHandler errors = new CollectingErrorHandler();
    Validator validator = schema.newValidator();
    validator.setErrorHandler(errors);
    restrictExternalAccess(validator);

    try {
      validator.validate(new StreamSource(new StringReader(xml)));
    } catch (SAXParseException e) {
      // Fatal errors abort the parse, usually after being reported to the handler.
      if (!errors.sawFatalError) {
        errors.record(Severity.FATAL, e);
      }
    } catch (SAXException e) {
      errors.violations.add(new SchemaViolation(Severity.FATAL, -1, -1, e.getMessage()));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }

    LOG.debug("Schema validation found {} violations.", errors.violations.size());
    return ImmutableList.copyOf(errors.violations);
  }

  private static void restrictExternalAccess(Validator validator) {
    try {
      validator.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
      validator.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
    } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
      LOG.warn("XML validator does not support restricting external access: " + e);
    }
  }

  private static class CollectingErrorHandler implements ErrorHandler {
    private final List<SchemaViolation> violations = Lists.newArrayList();
    private boolean sawFatalError;

    void record(Severity severity, SAXParseException e) {
      if (severity == Severity.FATAL) {
        sawFatalError = true;
      }
      violations.add(new SchemaViolation(
          severity,
          e.getLineNumber(),
          e.getColumnNumber(),
          e.getMessage()));
    }

    @Override
    public void warning(SAXParseException e) {
      record(Severity.WARNING, e);
    }

    @Override
    public void error(SAXParseException e) {
      record(Severity.ERROR, e);
    }

    @Override
    public void fatalError(SAXParseException e) {
      record(Severity.FATAL, e);
    }
  }
}

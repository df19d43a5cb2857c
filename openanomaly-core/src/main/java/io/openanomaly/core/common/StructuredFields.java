package io.openanomaly.core.common;

public class StructuredFields {
  public static final String PIPELINE = "pipeline";
  public static final String JOB_KIND = "job_kind";
  public static final String JOB_ID = "job_id";
  public static final String DUE_TIME = "due_time";
  public static final String IDEMPOTENCY_KEY = "idempotency_key";
  public static final String FENCING_TOKEN = "fencing_token";
  public static final String HOLDER_ID = "holder_id";
  public static final String ERROR_CLASS = "error_class";
  public static final String TECHNIQUE = "technique";
  public static final String MODEL_TYPE = "model_type";
  public static final String STATE = "state";
  public static final String URI = "uri";
  public static final String HOST = "host";
}

package com.ospicorp.navseries.series.source;

import java.util.List;
import java.util.Map;

public interface RecordSource {

  List<Map<String, Object>> fetch();

  String describe();
}

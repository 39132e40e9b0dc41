package com.physio.search.store;

import java.util.List;

record SqlFragment(String sql, List<Object> params) {
    SqlFragment {
        params = List.copyOf(params);
    }
}

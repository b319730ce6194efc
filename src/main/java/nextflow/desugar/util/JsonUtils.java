/*
 * Copyright 2024, Seqera Labs
 *
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
package nextflow.desugar.util;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Typed lookups of dotted paths in JSON settings,
 * e.g. {@code nextflow.desugar.definitions}.
 */
public class JsonUtils {

    public static List<String> getStringArray(Object json, String path) {
        var value = getObjectPath(json, path);
        if( value == null || !value.isJsonArray() )
            return null;
        var result = new ArrayList<String>();
        for( var el : value.getAsJsonArray() ) {
            if( !el.isJsonPrimitive() )
                continue;
            result.add(el.getAsString());
        }
        return result;
    }

    public static Boolean getBoolean(Object json, String path) {
        var value = getObjectPath(json, path);
        if( value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean() )
            return null;
        return value.getAsBoolean();
    }

    private static JsonElement getObjectPath(Object json, String path) {
        if( !(json instanceof JsonObject) )
            return null;

        JsonObject object = (JsonObject) json;
        var names = path.split("\\.");
        for( int i = 0; i < names.length - 1; i++ ) {
            var scope = names[i];
            if( !object.has(scope) || !object.get(scope).isJsonObject() )
                return null;
            object = object.get(scope).getAsJsonObject();
        }

        var property = names[names.length - 1];
        if( !object.has(property) )
            return null;
        return object.get(property);
    }

}

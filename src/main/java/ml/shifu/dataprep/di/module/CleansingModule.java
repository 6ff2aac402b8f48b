/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.dataprep.di.module;

import java.util.Arrays;
import java.util.List;

import ml.shifu.dataprep.container.obj.ProcessingConfig;
import ml.shifu.dataprep.di.builtin.DuplicateRowRemover;
import ml.shifu.dataprep.di.builtin.IqrOutlierDetector;
import ml.shifu.dataprep.di.builtin.MissingValueHandler;
import ml.shifu.dataprep.di.builtin.OutlierRemover;
import ml.shifu.dataprep.di.spi.OutlierDetector;
import ml.shifu.dataprep.di.spi.Transformation;
import ml.shifu.dataprep.exception.DataPrepErrorCode;
import ml.shifu.dataprep.exception.DataPrepException;

import org.apache.commons.lang3.ClassUtils;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;

/**
 * Binds the cleansing pipeline: the config, the {@link OutlierDetector} implementation and the ordered list of
 * {@link Transformation}s (deduplicate, remove outliers, handle missing values).
 */
public class CleansingModule extends AbstractModule {

    private final ProcessingConfig config;

    private Class<? extends OutlierDetector> outlierDetectorImplClass = IqrOutlierDetector.class;

    public CleansingModule(ProcessingConfig config) {
        this.config = config;
    }

    public void setOutlierDetectorImplClass(String className) {
        Class<?> clazz;
        try {
            clazz = ClassUtils.getClass(className);
        } catch (ClassNotFoundException e) {
            throw new DataPrepException(DataPrepErrorCode.ERROR_BINDING_CLASS, e, "Cannot find class " + className);
        }
        if(!OutlierDetector.class.isAssignableFrom(clazz)) {
            throw new DataPrepException(DataPrepErrorCode.ERROR_BINDING_CLASS, className + " is not an "
                    + OutlierDetector.class.getSimpleName());
        }
        setOutlierDetectorImplClass(clazz.asSubclass(OutlierDetector.class));
    }

    public void setOutlierDetectorImplClass(Class<? extends OutlierDetector> clazz) {
        this.outlierDetectorImplClass = clazz;
    }

    @Override
    protected void configure() {
        bind(ProcessingConfig.class).toInstance(config);
        bind(OutlierDetector.class).to(outlierDetectorImplClass);
    }

    @Provides
    List<Transformation> provideTransformations(DuplicateRowRemover duplicateRowRemover,
            OutlierRemover outlierRemover, MissingValueHandler missingValueHandler) {
        return Arrays.<Transformation> asList(duplicateRowRemover, outlierRemover, missingValueHandler);
    }
}

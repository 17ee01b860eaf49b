/**
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 * 
 * http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package dooplicity.mr.task;

/**
 * Counters every task reports. Bodies may add their own through the task context.
 */
public enum TaskCounter
{
  INPUT_RECORDS,
  INPUT_GROUPS,
  OUTPUT_RECORDS,
  SPILLS,
  CACHE_HITS,
  CACHE_COMPUTED,
  CACHE_RACE_LOSSES,
  CACHE_CLAIM_WAITS
}
